package org.truthtable.parser;

import org.junit.jupiter.api.Test;
import org.truthtable.formula.Formula;
import org.truthtable.formula.FormulaNode;
import org.truthtable.formula.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.truthtable.formula.FormulaNode.Type.AND;
import static org.truthtable.formula.FormulaNode.Type.EQUIV;
import static org.truthtable.formula.FormulaNode.Type.IMPLIES;
import static org.truthtable.formula.FormulaNode.Type.NAND;
import static org.truthtable.formula.FormulaNode.Type.NOR;
import static org.truthtable.formula.FormulaNode.Type.OR;
import static org.truthtable.formula.FormulaNode.Type.XOR;

public class FormulaParserTest {

    private static final FormulaNode A = var("A");
    private static final FormulaNode B = var("B");
    private static final FormulaNode C = var("C");

    private final FormulaParser parser = new FormulaParser();

    private static FormulaNode var(String name) {
        return FormulaNode.variable(Variable.of(name));
    }

    private static FormulaNode bin(FormulaNode.Type type, FormulaNode left, FormulaNode right) {
        return FormulaNode.binary(type, left, right);
    }

    private FormulaNode parse(String text) {
        return parser.parse(text).getRoot();
    }

    //region PRECEDENZA E ASSOCIATIVITÀ

    @Test
    void shouldParseLowercaseKeywords() {
        Formula formula = parser.parse("  a and b ");

        assertEquals("A AND B", formula.getText());
        assertEquals(bin(AND, A, B), formula.getRoot());
        assertThat(formula.getVariables()).containsExactly(Variable.of("A"), Variable.of("B"));
    }

    @Test
    void shouldBindAndTighterThanOr() {
        assertEquals(bin(OR, A, bin(AND, B, C)), parse("A OR B AND C"));
        assertEquals(bin(OR, bin(AND, A, B), C), parse("A AND B OR C"));
    }

    @Test
    void shouldBindOrTighterThanXor() {
        assertEquals(bin(XOR, A, bin(OR, B, C)), parse("A XOR B OR C"));
    }

    @Test
    void shouldBindXorTighterThanImplies() {
        assertEquals(bin(IMPLIES, bin(XOR, A, B), C), parse("A XOR B -> C"));
    }

    @Test
    void shouldBindImpliesTighterThanEquiv() {
        assertEquals(bin(EQUIV, A, bin(IMPLIES, B, C)), parse("A <-> B -> C"));
    }

    @Test
    void shouldAssociateBinaryOperatorsToTheLeft() {
        assertEquals(bin(IMPLIES, bin(IMPLIES, A, B), C), parse("A -> B -> C"));
        assertEquals(bin(EQUIV, bin(EQUIV, A, B), C), parse("A <-> B <-> C"));
        assertEquals(bin(AND, bin(AND, A, B), C), parse("A AND B AND C"));
    }

    @Test
    void shouldApplyNotToFollowingAtomOnly() {
        assertEquals(bin(AND, FormulaNode.not(A), B), parse("NOT A AND B"));
        assertEquals(FormulaNode.not(bin(AND, A, B)), parse("NOT (A AND B)"));
        assertEquals(FormulaNode.not(FormulaNode.not(A)), parse("NOT NOT A"));
    }

    @Test
    void shouldOverridePrecedenceWithParentheses() {
        assertEquals(bin(AND, bin(OR, A, B), C), parse("(A OR B) AND C"));
        assertEquals(bin(IMPLIES, A, bin(IMPLIES, B, C)), parse("A -> (B -> C)"));
    }

    //endregion

    //region FUNZIONI, ALIAS E COSTANTI

    @Test
    void shouldParseNestedFunctionArguments() {
        FormulaNode expected = bin(NAND,
                bin(OR, A, bin(AND, B, C)),
                bin(NOR, A, FormulaNode.not(C)));

        assertEquals(expected, parse("NAND(A OR (B AND C), NOR(A, NOT C))"));
    }

    @Test
    void shouldAcceptFunctionAsOperand() {
        assertEquals(bin(AND, bin(NOR, A, B), C), parse("NOR(A,B) AND C"));
        assertEquals(FormulaNode.not(bin(NAND, A, B)), parse("NOT NAND(A, B)"));
    }

    @Test
    void shouldTreatXorFunctionLikeInfixXor() {
        assertEquals(parse("A XOR B"), parse("XOR(A, B)"));
    }

    @Test
    void shouldParseSymbolicAliases() {
        assertEquals(parse("NOT A AND B OR C XOR A"), parse("!A & B | C ^ A"));
        assertEquals(parse("NOT A"), parse("~A"));
        assertEquals(parse("A -> B"), parse("A IMPLIES B"));
        assertEquals(parse("A <-> B"), parse("A EQUIV B"));
    }

    @Test
    void shouldParseConstants() {
        Formula formula = parser.parse("true or false");

        assertEquals(bin(OR, FormulaNode.constant(true), FormulaNode.constant(false)), formula.getRoot());
        assertThat(formula.getVariables()).isEmpty();
    }

    @Test
    void shouldReparseItsOwnRendering() {
        FormulaNode original = parse("NAND(A -> B, NOT C) <-> (A XOR NOR(B, TRUE))");

        assertEquals(original, parse(original.toString()));
    }

    //endregion

    //region ERRORI DI SINTASSI

    @Test
    void shouldRejectUnmatchedOpeningParenthesis() {
        assertThatThrownBy(() -> parser.parse("A AND (B"))
                .isInstanceOf(FormulaSyntaxException.class)
                .satisfies(e -> {
                    FormulaSyntaxException error = (FormulaSyntaxException) e;
                    assertEquals(8, error.getPosition());
                    assertEquals("A AND (B", error.getFragment());
                });
    }

    @Test
    void shouldRejectUnmatchedClosingParenthesis() {
        assertThatThrownBy(() -> parser.parse("A AND B)"))
                .isInstanceOf(FormulaSyntaxException.class)
                .satisfies(e -> assertEquals(")", ((FormulaSyntaxException) e).getFragment()));
    }

    @Test
    void shouldRejectEmptyFormula() {
        assertThatThrownBy(() -> parser.parse("   "))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("formula vuota");
        assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(FormulaSyntaxException.class);
    }

    @Test
    void shouldRejectUnknownCharacter() {
        assertThatThrownBy(() -> parser.parse("a $ b"))
                .isInstanceOf(FormulaSyntaxException.class)
                .satisfies(e -> {
                    FormulaSyntaxException error = (FormulaSyntaxException) e;
                    assertEquals("$", error.getFragment());
                    assertEquals(2, error.getPosition());
                });
    }

    @Test
    void shouldRejectUnknownWords() {
        assertThatThrownBy(() -> parser.parse("A ANDX B"))
                .isInstanceOf(FormulaSyntaxException.class)
                .satisfies(e -> {
                    FormulaSyntaxException error = (FormulaSyntaxException) e;
                    assertEquals("ANDX", error.getFragment());
                    assertEquals(2, error.getPosition());
                });
        assertThatThrownBy(() -> parser.parse("AB OR C")).isInstanceOf(FormulaSyntaxException.class);
    }

    @Test
    void shouldRejectFunctionsWithoutExactlyTwoArguments() {
        assertThatThrownBy(() -> parser.parse("NAND(A,B,C)"))
                .isInstanceOf(FormulaSyntaxException.class)
                .satisfies(e -> {
                    FormulaSyntaxException error = (FormulaSyntaxException) e;
                    assertEquals(",", error.getFragment());
                    assertEquals(8, error.getPosition());
                });
        assertThatThrownBy(() -> parser.parse("NOR(A)")).isInstanceOf(FormulaSyntaxException.class);
        assertThatThrownBy(() -> parser.parse("NAND()")).isInstanceOf(FormulaSyntaxException.class);
    }

    @Test
    void shouldRejectNonAsciiLettersAtTheirPosition() {
        assertThatThrownBy(() -> parser.parse("ı and b"))
                .isInstanceOf(FormulaSyntaxException.class)
                .satisfies(e -> {
                    FormulaSyntaxException error = (FormulaSyntaxException) e;
                    assertEquals("ı", error.getFragment());
                    assertEquals(0, error.getPosition());
                });
        assertThatThrownBy(() -> parser.parse("a ß b"))
                .isInstanceOf(FormulaSyntaxException.class)
                .satisfies(e -> {
                    FormulaSyntaxException error = (FormulaSyntaxException) e;
                    assertEquals("ß", error.getFragment());
                    assertEquals(2, error.getPosition());
                });
    }

    @Test
    void shouldRejectMissingOperands() {
        assertThatThrownBy(() -> parser.parse("A AND")).isInstanceOf(FormulaSyntaxException.class);
        assertThatThrownBy(() -> parser.parse("-> B")).isInstanceOf(FormulaSyntaxException.class);
        assertThatThrownBy(() -> parser.parse("A B"))
                .isInstanceOf(FormulaSyntaxException.class)
                .satisfies(e -> assertEquals("B", ((FormulaSyntaxException) e).getFragment()));
    }

    //endregion

    //region LOGGING

    @Test
    void shouldLogTreeDetailsOnlyWhenFineIsEnabled() {
        Logger logger = Logger.getLogger(FormulaParser.class.getName());
        Level previousLevel = logger.getLevel();
        List<String> messages = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);

        try {
            logger.setLevel(Level.FINE);
            parser.parse("A AND NOT B");
            assertThat(messages).anyMatch(message -> message.contains("profondità=2"));

            messages.clear();
            logger.setLevel(Level.INFO);
            parser.parse("A AND NOT B");
            assertThat(messages).isEmpty();
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(previousLevel);
        }
    }

    //endregion
}
