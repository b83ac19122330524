package org.truthtable.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.truthtable.antlr.LogicFormulaBaseVisitor;
import org.truthtable.antlr.LogicFormulaParser.AndContext;
import org.truthtable.antlr.LogicFormulaParser.EquivContext;
import org.truthtable.antlr.LogicFormulaParser.FalseContext;
import org.truthtable.antlr.LogicFormulaParser.FormulaContext;
import org.truthtable.antlr.LogicFormulaParser.ImpliesContext;
import org.truthtable.antlr.LogicFormulaParser.NandContext;
import org.truthtable.antlr.LogicFormulaParser.NorContext;
import org.truthtable.antlr.LogicFormulaParser.NotContext;
import org.truthtable.antlr.LogicFormulaParser.OrContext;
import org.truthtable.antlr.LogicFormulaParser.ParContext;
import org.truthtable.antlr.LogicFormulaParser.PrimaryContext;
import org.truthtable.antlr.LogicFormulaParser.TrueContext;
import org.truthtable.antlr.LogicFormulaParser.VarContext;
import org.truthtable.antlr.LogicFormulaParser.XorCallContext;
import org.truthtable.antlr.LogicFormulaParser.XorContext;
import org.truthtable.formula.FormulaNode;
import org.truthtable.formula.Variable;

import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DELL'ALBERO - Da albero di parsing ANTLR a {@link FormulaNode}
 *
 * Implementa il visitor generato dalla grammatica LogicFormula e produce l'albero
 * sintattico tipizzato, senza alcuna trasformazione semantica: implicazioni,
 * equivalenze e funzioni NAND/NOR restano nodi dedicati e vengono interpretate
 * solo dal valutatore.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Equivalenza (<->, EQUIV)
 * - Implicazione (->, IMPLIES)
 * - Disgiunzione esclusiva (XOR, ^)
 * - Disgiunzione (OR, |)
 * - Congiunzione (AND, &)
 * - Negazione (NOT, !, ~), prefissa
 * - Atomi: variabili, costanti, parentesi, NAND(x, y), NOR(x, y), XOR(x, y)
 *
 * ASSOCIATIVITÀ:
 * - Tutti gli operatori binari associano a sinistra: A -> B -> C ~ (A -> B) -> C
 */
public class FormulaTreeBuilder extends LogicFormulaBaseVisitor<FormulaNode> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Punto di ingresso: visita la formula completa a partire dall'equivalenza,
     * il livello di precedenza più basso.
     *
     * @param ctx contesto della formula completa
     * @return radice dell'albero sintattico
     */
    @Override
    public FormulaNode visitFormula(FormulaContext ctx) {
        LOGGER.fine("Inizio costruzione albero da parse tree ANTLR");

        FormulaNode root = visit(ctx.equivalence());

        LOGGER.fine("Albero costruito: " + root);
        return root;
    }

    //endregion

    //region OPERATORI BINARI INFISSI

    @Override
    public FormulaNode visitEquiv(EquivContext ctx) {
        return foldLeft(FormulaNode.Type.EQUIV, ctx.implication());
    }

    @Override
    public FormulaNode visitImplies(ImpliesContext ctx) {
        return foldLeft(FormulaNode.Type.IMPLIES, ctx.exclusiveOr());
    }

    @Override
    public FormulaNode visitXor(XorContext ctx) {
        return foldLeft(FormulaNode.Type.XOR, ctx.disjunction());
    }

    @Override
    public FormulaNode visitOr(OrContext ctx) {
        return foldLeft(FormulaNode.Type.OR, ctx.conjunction());
    }

    @Override
    public FormulaNode visitAnd(AndContext ctx) {
        return foldLeft(FormulaNode.Type.AND, ctx.negation());
    }

    /**
     * Combina una catena di operandi dello stesso livello associando a sinistra.
     * Con un solo operando restituisce direttamente il sottoalbero, senza wrapper.
     *
     * @param type operatore binario del livello
     * @param operands contesti degli operandi nell'ordine del testo
     * @return sottoalbero risultante
     */
    private FormulaNode foldLeft(FormulaNode.Type type, List<? extends ParserRuleContext> operands) {
        FormulaNode result = visit(operands.get(0));

        if (operands.size() > 1) {
            LOGGER.finest("Catena " + type + " con " + operands.size() + " operandi");
        }

        for (int i = 1; i < operands.size(); i++) {
            result = FormulaNode.binary(type, result, visit(operands.get(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONE E PARENTESI

    @Override
    public FormulaNode visitNot(NotContext ctx) {
        return FormulaNode.not(visit(ctx.negation()));
    }

    @Override
    public FormulaNode visitPrimary(PrimaryContext ctx) {
        return visit(ctx.atom());
    }

    /**
     * Le parentesi non producono nodi: servono solo a fissare la precedenza.
     */
    @Override
    public FormulaNode visitPar(ParContext ctx) {
        return visit(ctx.equivalence());
    }

    //endregion

    //region FUNZIONI A DUE ARGOMENTI

    @Override
    public FormulaNode visitNand(NandContext ctx) {
        return FormulaNode.binary(FormulaNode.Type.NAND, visit(ctx.equivalence(0)), visit(ctx.equivalence(1)));
    }

    @Override
    public FormulaNode visitNor(NorContext ctx) {
        return FormulaNode.binary(FormulaNode.Type.NOR, visit(ctx.equivalence(0)), visit(ctx.equivalence(1)));
    }

    /**
     * Forma funzionale XOR(x, y), equivalente alla forma infissa x XOR y.
     */
    @Override
    public FormulaNode visitXorCall(XorCallContext ctx) {
        return FormulaNode.binary(FormulaNode.Type.XOR, visit(ctx.equivalence(0)), visit(ctx.equivalence(1)));
    }

    //endregion

    //region ATOMI E COSTANTI

    @Override
    public FormulaNode visitVar(VarContext ctx) {
        String name = ctx.VARIABLE().getText();
        LOGGER.finest("Variabile atomica: " + name);
        return FormulaNode.variable(Variable.of(name));
    }

    @Override
    public FormulaNode visitTrue(TrueContext ctx) {
        return FormulaNode.constant(true);
    }

    @Override
    public FormulaNode visitFalse(FalseContext ctx) {
        return FormulaNode.constant(false);
    }

    //endregion
}
