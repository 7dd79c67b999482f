package com.constlang.playground.repair;

import com.constlang.playground.grammar.Grammar;
import com.constlang.playground.lexer.Diagnostic;
import com.constlang.playground.lexer.DiagnosticType;
import com.constlang.playground.lexer.KeywordCorrector;
import com.constlang.playground.lexer.Scanner;
import com.constlang.playground.lexer.Token;
import com.constlang.playground.lexer.TokenKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RepairSearchEngine.
 *
 * Inputs are produced by the real scanner so positions match what a client would see.
 */
class RepairSearchEngineTest {

    private static final List<String> BROKEN_INPUTS = List.of(
            "const x i32 = 5;",
            "const x : i32 = ;",
            "const x : i32 = 5;;",
            "const x : i32 = 5",
            "const x : int = 5;",
            "const : i32 = 5;",
            "const x : i32 = 5 + 3;",
            "const a i32 = 1;\nconst b : i32 = ;",
            "const a : i32 = 1\nconst b : i32 = 2;",
            "5",
            "const");

    private Scanner scanner;
    private RepairSearchEngine engine;

    @BeforeEach
    void setUp() {
        scanner = new Scanner(new KeywordCorrector());
        engine = new RepairSearchEngine(Grammar.constDeclaration(), new DiagnosticsBuilder());
    }

    private List<Token> scan(String text) {
        return scanner.tokenize(text).tokens();
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }

    @Test
    void testValidDeclarationIsUntouched() {
        List<Token> tokens = scan("const x : i32 = 5;");

        RepairResult result = engine.validate(tokens);

        assertEquals(tokens, result.tokens());
        assertTrue(result.edits().isEmpty());
        assertTrue(result.diagnostics().isEmpty());
        assertFalse(result.budgetExceeded());
        assertTrue(result.isClean());
    }

    @Test
    void testValidNegativeValueAndSeveralStatements() {
        List<Token> tokens = scan("const x : i32 = -5;\nconst y : i32 = 10;\nconst z : i32 = 0;");

        RepairResult result = engine.validate(tokens);

        assertTrue(result.isClean());
        assertEquals(tokens, result.tokens());
    }

    @Test
    void testEmptyInputIsAccepted() {
        RepairResult result = engine.validate(List.of());

        assertTrue(result.isClean());
        assertTrue(result.tokens().isEmpty());
    }

    @Test
    void testMissingColonIsInserted() {
        RepairResult result = engine.validate(scan("const x i32 = 5;"));

        assertEquals(List.of(TokenKind.CONST, TokenKind.IDENTIFIER, TokenKind.COLON, TokenKind.I32,
                TokenKind.ASSIGN, TokenKind.NUMBER, TokenKind.SEMICOLON), kinds(result.tokens()));
        assertEquals(List.of(new EditOp.Insert(2, new Token(TokenKind.COLON, ":", 1, 9))), result.edits());
        assertEquals(List.of(new Diagnostic(1, 9, DiagnosticType.REPAIR, "inserted missing token ':'")),
                result.diagnostics());
    }

    @Test
    void testMissingNumberIsInserted() {
        RepairResult result = engine.validate(scan("const x : i32 = ;"));

        assertEquals(1, result.edits().size());
        EditOp.Insert insert = assertInstanceOf(EditOp.Insert.class, result.edits().get(0));
        assertEquals(TokenKind.NUMBER, insert.token().kind());
        assertEquals(5, insert.position());
        assertEquals("inserted missing token '0'", result.diagnostics().get(0).message());
        assertEquals(17, result.diagnostics().get(0).column());
    }

    @Test
    void testExtraSemicolonIsDeleted() {
        RepairResult result = engine.validate(scan("const x : i32 = 5;;"));

        assertEquals(List.of(new EditOp.Delete(7, new Token(TokenKind.SEMICOLON, ";", 1, 19))), result.edits());
        assertEquals("removed unexpected token ';'", result.diagnostics().get(0).message());
        assertEquals(7, result.tokens().size());
    }

    @Test
    void testMissingSemicolonIsAppendedAfterLastToken() {
        RepairResult result = engine.validate(scan("const x : i32 = 15"));

        assertEquals(List.of(new EditOp.Insert(6, new Token(TokenKind.SEMICOLON, ";", 1, 19))), result.edits());
    }

    @Test
    void testWrongTypeIsReplaced() {
        RepairResult result = engine.validate(scan("const x : int = 5;"));

        assertEquals(1, result.edits().size());
        EditOp.Replace replace = assertInstanceOf(EditOp.Replace.class, result.edits().get(0));
        assertEquals("int", replace.oldToken().text());
        assertEquals(TokenKind.I32, replace.newToken().kind());
        assertEquals(new Diagnostic(1, 11, DiagnosticType.REPAIR, "replaced 'int' with 'i32'"),
                result.diagnostics().get(0));
    }

    @Test
    void testMissingSemicolonBetweenStatements() {
        RepairResult result = engine.validate(scan("const a : i32 = 1\nconst b : i32 = 2;"));

        assertEquals(1, result.edits().size());
        EditOp.Insert insert = assertInstanceOf(EditOp.Insert.class, result.edits().get(0));
        assertEquals(TokenKind.SEMICOLON, insert.token().kind());
        assertEquals(2, insert.token().line());
        assertEquals(14, result.tokens().size());
    }

    @Test
    void testMissingSemicolonOnEveryLine() {
        RepairResult result = engine.validate(scan("const x : i32 = 5\n".repeat(10)));

        assertFalse(result.budgetExceeded());
        assertEquals(10, result.edits().size());
        assertTrue(result.edits().stream().allMatch(edit -> edit instanceof EditOp.Insert insert
                && insert.token().kind() == TokenKind.SEMICOLON));
        assertEquals(70, result.tokens().size());
        assertTrue(result.expandedBranches() < 10_000);
    }

    @Test
    void testNameReadAsConstCostsOneRepair() {
        List<Token> tokens = scan("const count : i32 = 5;");
        assertEquals(TokenKind.CONST, tokens.get(1).kind());

        RepairResult result = engine.validate(tokens);

        assertFalse(result.budgetExceeded());
        assertEquals(1, result.edits().size());
    }

    @Test
    void testDiagnosticsFollowEditOrderAcrossStatements() {
        RepairResult result = engine.validate(scan("const a i32 = 1;\nconst b : i32 = ;"));

        assertEquals(List.of(
                new Diagnostic(1, 9, DiagnosticType.REPAIR, "inserted missing token ':'"),
                new Diagnostic(2, 17, DiagnosticType.REPAIR, "inserted missing token '0'")),
                result.diagnostics());
    }

    @Test
    void testBudgetIsCountedPerStatement() {
        // five stray '+' per statement, twenty in total
        String statement = "const a : i32 = 1 + + + + + ;\n";
        RepairResult result = engine.validate(scan(statement.repeat(4)));

        assertFalse(result.budgetExceeded());
        assertEquals(20, result.edits().size());
        assertTrue(result.edits().stream().allMatch(edit -> edit instanceof EditOp.Delete));
    }

    @Test
    void testGarbageExceedsBudget() {
        List<Token> tokens = scan("+ ".repeat(20));
        assertEquals(20, tokens.size());

        RepairResult result = engine.validate(tokens);

        assertTrue(result.budgetExceeded());
        assertEquals(tokens, result.tokens());
        assertTrue(result.edits().isEmpty());
        assertEquals(1, result.diagnostics().size());
        assertEquals(DiagnosticType.BUDGET_EXCEEDED, result.diagnostics().get(0).type());
    }

    @Test
    void testQueueRunsDryWhenEveryRepairIsTooExpensive() {
        // a lone "const" needs six insertions
        RepairSearchEngine tight = new RepairSearchEngine(Grammar.constDeclaration(), new DiagnosticsBuilder(), 5, 100_000);
        List<Token> tokens = scan("const");

        RepairResult result = tight.validate(tokens);

        assertTrue(result.budgetExceeded());
        assertEquals(tokens, result.tokens());
        assertTrue(result.expandedBranches() < 100_000);
    }

    @Test
    void testRepairUsingTheWholeBudgetIsAccepted() {
        RepairSearchEngine exact = new RepairSearchEngine(Grammar.constDeclaration(), new DiagnosticsBuilder(), 6, 100_000);

        RepairResult result = exact.validate(scan("const"));

        assertFalse(result.budgetExceeded());
        assertEquals(6, result.edits().size());
        assertEquals(List.of(TokenKind.CONST, TokenKind.IDENTIFIER, TokenKind.COLON, TokenKind.I32,
                TokenKind.ASSIGN, TokenKind.NUMBER, TokenKind.SEMICOLON), kinds(result.tokens()));
    }

    @Test
    void testExpansionCapStopsTheSearch() {
        RepairSearchEngine capped = new RepairSearchEngine(Grammar.constDeclaration(), new DiagnosticsBuilder(), 15, 3);

        RepairResult result = capped.validate(scan("const x i32 = 5;"));

        assertTrue(result.budgetExceeded());
        assertEquals(1, result.diagnostics().size());
    }

    @Test
    void testEditCountStaysWithinBudget() {
        for (String input : BROKEN_INPUTS) {
            RepairResult result = engine.validate(scan(input));
            assertFalse(result.budgetExceeded(), input);
            assertTrue(result.edits().size() <= RepairSearchEngine.MAX_EDIT_COUNT, input);
            assertEquals(result.edits().size(), result.diagnostics().size(), input);
        }
    }

    @Test
    void testRepairIsIdempotent() {
        for (String input : BROKEN_INPUTS) {
            RepairResult first = engine.validate(scan(input));
            RepairResult second = engine.validate(first.tokens());

            assertTrue(second.isClean(), input);
            assertEquals(first.tokens(), second.tokens(), input);
        }
    }

    @Test
    void testRevertingTheLogRestoresTheInput() {
        for (String input : BROKEN_INPUTS) {
            List<Token> original = scan(input);
            RepairResult result = engine.validate(original);

            assertEquals(original, EditOp.revert(result.tokens(), result.edits()), input);
        }
    }

    @Test
    void testResultsAreDeterministic() {
        for (String input : BROKEN_INPUTS) {
            assertEquals(engine.validate(scan(input)), engine.validate(scan(input)), input);
        }
    }

    @Test
    void testInputListIsNotModified() {
        List<Token> tokens = scan("const x i32 = 5;");
        List<Token> snapshot = List.copyOf(tokens);

        engine.validate(Collections.unmodifiableList(tokens));

        assertEquals(snapshot, tokens);
    }

    @Test
    void testInvalidLimitsAreRejected() {
        Grammar grammar = Grammar.constDeclaration();
        assertThrows(IllegalArgumentException.class,
                () -> new RepairSearchEngine(grammar, new DiagnosticsBuilder(), -1, 10));
        assertThrows(IllegalArgumentException.class,
                () -> new RepairSearchEngine(grammar, new DiagnosticsBuilder(), 15, 0));
    }
}
