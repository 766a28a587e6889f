package com.analysis.nodeflow.infer;

import org.junit.Test;

import java.util.Set;

import static org.junit.Assert.*;

public class CodeScannerTest {
    private final CodeScanner scanner = new CodeScanner();

    @Test
    public void testAssignmentSplitsReadsFromTargets() {
        ScanResult r = scanner.scan("total = orders['amount'].sum() + fees");

        assertEquals(Set.of("total"), r.assigned());
        assertTrue(r.reads().containsAll(Set.of("orders", "fees")));
        assertFalse(r.reads().contains("total"));
        assertFalse("attribute names are not reads", r.reads().contains("sum"));
    }

    @Test
    public void testCommentsAndStringsAreIgnored() {
        ScanResult r = scanner.scan("# uses load_orders\nresult = 'load_customers'\n");

        assertEquals(Set.of("result"), r.assigned());
        assertTrue(r.reads().isEmpty());
    }

    @Test
    public void testTripleQuotedStringsAreIgnored() {
        ScanResult r = scanner.scan("\"\"\"\nDocs mention raw_sales here.\n\"\"\"\nsummary = clean_sales.describe()");

        assertEquals(Set.of("clean_sales"), r.reads());
    }

    @Test
    public void testSubscriptTargetReadsOwnerAndIndex() {
        ScanResult r = scanner.scan("frame[column] = 1\nobj.attr = value");

        assertTrue(r.reads().containsAll(Set.of("frame", "column", "obj", "value")));
        assertTrue(r.assigned().isEmpty());
    }

    @Test
    public void testTupleAndChainedTargets() {
        ScanResult r = scanner.scan("a, (b, c) = pairs\nx = y = source");

        assertEquals(Set.of("a", "b", "c", "x", "y"), r.assigned());
        assertEquals(Set.of("pairs", "source"), r.reads());
    }

    @Test
    public void testAugmentedAndAnnotatedAssignment() {
        ScanResult r = scanner.scan("count += step\nlimit: int = default_limit\nlabel: str");

        assertEquals(Set.of("count", "limit", "label"), r.assigned());
        assertTrue(r.reads().containsAll(Set.of("step", "int", "default_limit", "str")));
    }

    @Test
    public void testFunctionDefinition() {
        ScanResult r = scanner.scan("def score(row, weight=base_weight, *args, **kw) -> float:\n"
                + "    return row['x'] * weight + offset\n");

        assertEquals(Set.of("score"), r.defined());
        assertTrue(r.reads().containsAll(Set.of("base_weight", "float", "row", "weight", "offset")));
    }

    @Test
    public void testDecoratorAndClass() {
        ScanResult r = scanner.scan("@cache(size=limit)\nclass Model(BaseModel):\n    pass\n");

        assertEquals(Set.of("Model"), r.defined());
        assertTrue(r.reads().containsAll(Set.of("cache", "limit", "BaseModel")));
        assertFalse("keyword argument names are not reads", r.reads().contains("size"));
    }

    @Test
    public void testImportsBind() {
        ScanResult r = scanner.scan("import pandas as pd\nimport os.path\nfrom numpy import (array, nan as missing)\n"
                + "from helpers import *");

        assertEquals(Set.of("pd", "os", "array", "missing"), r.bound());
        assertTrue(r.reads().isEmpty());
    }

    @Test
    public void testLoopsAndWithBind() {
        ScanResult r = scanner.scan("for key, value in mapping.items():\n    total = key\n"
                + "with open(path) as fh:\n    text = fh.read()\n");

        assertTrue(r.bound().containsAll(Set.of("key", "value", "fh")));
        assertTrue(r.reads().containsAll(Set.of("mapping", "open", "path")));
        assertEquals(Set.of("total", "text"), r.assigned());
    }

    @Test
    public void testComprehensionTargetsAndLambdaParams() {
        ScanResult r = scanner.scan("rows = [f(item) for item in raw_items if item]\n"
                + "key = lambda entry, n=width: entry[n]\n");

        assertTrue(r.bound().contains("item"));
        assertTrue(r.reads().containsAll(Set.of("f", "raw_items", "width")));
        assertEquals(Set.of("rows", "key"), r.assigned());
    }

    @Test
    public void testWalrusBinds() {
        ScanResult r = scanner.scan("if (n := len(values)) > 10:\n    big = n\n");

        assertTrue(r.bound().contains("n"));
        assertTrue(r.reads().containsAll(Set.of("len", "values")));
        assertEquals(Set.of("big"), r.assigned());
    }

    @Test
    public void testFStringFieldsAreRead() {
        ScanResult r = scanner.scan("title = f'{region!r}: {revenue:.{digits}f} {{literal}}'");

        assertEquals(Set.of("region", "revenue", "digits"), r.reads());
        assertFalse(r.reads().contains("literal"));
    }

    @Test
    public void testSemicolonsSplitStatements() {
        ScanResult r = scanner.scan("a = 1; b = a + source");

        assertEquals(Set.of("a", "b"), r.assigned());
        assertEquals(Set.of("a", "source"), r.reads());
    }

    @Test
    public void testBracketsSpanLines() {
        ScanResult r = scanner.scan("merged = combine(\n    left,\n    right,\n)\n");

        assertEquals(Set.of("merged"), r.assigned());
        assertEquals(Set.of("combine", "left", "right"), r.reads());
    }

    @Test
    public void testDeleteReadsNothingBinds() {
        ScanResult r = scanner.scan("del cache[key], scratch");

        assertTrue(r.reads().containsAll(Set.of("cache", "key")));
        assertTrue(r.assigned().isEmpty());
    }

    @Test
    public void testMalformedCode() {
        assertSyntaxError("x = (1 +\n");
        assertSyntaxError("x = 'unterminated\n");
        assertSyntaxError("x = [1, 2)\n");
        assertSyntaxError("y = 1 ?\n");
        assertSyntaxError("if x\n    y = 1\n");
        assertSyntaxError("= 5\n");
    }

    @Test
    public void testSyntaxErrorCarriesLine() {
        try {
            scanner.scan("a = 1\nb = 2\nc = )\n");
            fail("Expected CodeSyntaxException");
        } catch (CodeSyntaxException e) {
            assertEquals(3, e.line());
            assertTrue(e.getMessage().startsWith("line 3: "));
        }
    }

    private void assertSyntaxError(String code) {
        try {
            scanner.scan(code);
            fail("Expected CodeSyntaxException for: " + code);
        } catch (CodeSyntaxException expected) {
            // expected
        }
    }

    @Test
    public void testMatchStatementReadsSubject() {
        ScanResult r = scanner.scan("match orders:\n    case _:\n        report = 1\n");

        assertEquals(Set.of("orders"), r.reads());
        assertEquals(Set.of("report"), r.assigned());
    }

    @Test
    public void testCasePatterns() {
        ScanResult r = scanner.scan("match event['kind']:\n"
                + "    case Sale(amount=amt) if amt > threshold:\n"
                + "        total = amt\n"
                + "    case Status.CLOSED | [first, *rest]:\n"
                + "        total = 0\n"
                + "    case {'id': key} as whole:\n"
                + "        total = key\n");

        assertTrue(r.reads().containsAll(Set.of("event", "Sale", "threshold", "Status")));
        assertFalse("keyword pattern names are attributes", r.reads().contains("amount"));
        assertTrue(r.bound().containsAll(Set.of("amt", "first", "rest", "key", "whole")));
        assertFalse(r.bound().contains("CLOSED"));
    }

    @Test
    public void testMatchAndCaseAsPlainNames() {
        ScanResult r = scanner.scan("match = pattern.search(text)\ncase = match.group(1)\nresult = match(case)");

        assertEquals(Set.of("match", "case", "result"), r.assigned());
        assertTrue(r.reads().containsAll(Set.of("pattern", "text", "match", "case")));
    }

    @Test
    public void testParenthesisedWithTargetBindsEveryName() {
        ScanResult r = scanner.scan("with open(p) as (a, orders):\n    pass\n");

        assertEquals(Set.of("open", "p"), r.reads());
        assertEquals(Set.of("a", "orders"), r.bound());
    }
}
