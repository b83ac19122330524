package org.truthtable.formula;

import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Nodo dell'albero sintattico di una formula proposizionale
 *
 * Variante etichettata: il campo {@link Type} indica quale costrutto rappresenta
 * il nodo e quali campi sono valorizzati. I figli appartengono esclusivamente al
 * nodo padre e l'albero, una volta costruito, non viene più modificato.
 *
 * CAMPI PER TIPO:
 * - VARIABLE: variable
 * - CONSTANT: value
 * - NOT: operand
 * - AND, OR, XOR, IMPLIES, EQUIV, NAND, NOR: left, right
 */
public final class FormulaNode {

    //region TIPI E STRUTTURA DATI

    /**
     * Costrutti supportati dalla grammatica.
     */
    public enum Type {
        VARIABLE,   // Lettera: A, B, ...
        CONSTANT,   // TRUE / FALSE
        NOT,        // NOT A
        AND,        // A AND B
        OR,         // A OR B
        XOR,        // A XOR B
        IMPLIES,    // A -> B
        EQUIV,      // A <-> B
        NAND,       // NAND(A, B)
        NOR;        // NOR(A, B)

        /**
         * @return true se il tipo rappresenta un operatore a due operandi
         */
        public boolean isBinary() {
            return this != VARIABLE && this != CONSTANT && this != NOT;
        }
    }

    private final Type type;

    /** Solo per nodi VARIABLE */
    private final Variable variable;

    /** Solo per nodi CONSTANT */
    private final boolean value;

    /** Solo per nodi NOT */
    private final FormulaNode operand;

    /** Solo per operatori binari */
    private final FormulaNode left;
    private final FormulaNode right;

    //endregion

    //region COSTRUTTORI E FACTORY

    private FormulaNode(Type type, Variable variable, boolean value,
                        FormulaNode operand, FormulaNode left, FormulaNode right) {
        this.type = type;
        this.variable = variable;
        this.value = value;
        this.operand = operand;
        this.left = left;
        this.right = right;
    }

    /**
     * Costruisce una foglia variabile.
     *
     * @param variable variabile referenziata (non null)
     * @return nodo VARIABLE
     */
    public static FormulaNode variable(Variable variable) {
        if (variable == null) {
            throw new IllegalArgumentException("Variabile non può essere null");
        }
        return new FormulaNode(Type.VARIABLE, variable, false, null, null, null);
    }

    /**
     * Costruisce una foglia costante.
     *
     * @param value valore della costante
     * @return nodo CONSTANT
     */
    public static FormulaNode constant(boolean value) {
        return new FormulaNode(Type.CONSTANT, null, value, null, null, null);
    }

    /**
     * Costruisce una negazione.
     *
     * @param operand sottoformula da negare (non null)
     * @return nodo NOT
     */
    public static FormulaNode not(FormulaNode operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new FormulaNode(Type.NOT, null, false, operand, null, null);
    }

    /**
     * Costruisce un nodo binario.
     *
     * @param type operatore binario (AND, OR, XOR, IMPLIES, EQUIV, NAND, NOR)
     * @param left operando sinistro (non null)
     * @param right operando destro (non null)
     * @return nodo binario
     * @throws IllegalArgumentException se il tipo non è binario o gli operandi sono null
     */
    public static FormulaNode binary(Type type, FormulaNode left, FormulaNode right) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo deve essere un operatore binario, ricevuto: " + type);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi di " + type + " non possono essere null");
        }
        return new FormulaNode(type, null, false, null, left, right);
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    /**
     * @return variabile della foglia (null se il nodo non è VARIABLE)
     */
    public Variable getVariable() {
        return variable;
    }

    /**
     * @return valore della costante (significativo solo per CONSTANT)
     */
    public boolean getValue() {
        return value;
    }

    public FormulaNode getOperand() {
        return operand;
    }

    public FormulaNode getLeft() {
        return left;
    }

    public FormulaNode getRight() {
        return right;
    }

    //endregion

    //region ANALISI STRUTTURALE

    /**
     * Raccoglie le variabili referenziate nel sottoalbero, in ordine alfabetico.
     */
    public SortedSet<Variable> collectVariables() {
        SortedSet<Variable> variables = new TreeSet<>();
        collectVariables(variables);
        return variables;
    }

    private void collectVariables(SortedSet<Variable> variables) {
        switch (type) {
            case VARIABLE -> variables.add(variable);
            case CONSTANT -> { /* nessuna variabile */ }
            case NOT -> operand.collectVariables(variables);
            default -> {
                left.collectVariables(variables);
                right.collectVariables(variables);
            }
        }
    }

    /**
     * Calcola la profondità massima dell'albero.
     */
    public int calculateDepth() {
        return switch (type) {
            case VARIABLE, CONSTANT -> 0;
            case NOT -> 1 + operand.calculateDepth();
            default -> 1 + Math.max(left.calculateDepth(), right.calculateDepth());
        };
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale ricorsiva.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        FormulaNode other = (FormulaNode) obj;
        if (this.type != other.type) return false;

        return switch (type) {
            case VARIABLE -> variable.equals(other.variable);
            case CONSTANT -> value == other.value;
            case NOT -> operand.equals(other.operand);
            default -> left.equals(other.left) && right.equals(other.right);
        };
    }

    @Override
    public int hashCode() {
        return switch (type) {
            case VARIABLE -> Objects.hash(type, variable);
            case CONSTANT -> Objects.hash(type, value);
            case NOT -> Objects.hash(type, operand);
            default -> Objects.hash(type, left, right);
        };
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione completamente parentesizzata, rileggibile dal parser.
     * Esempio: {@code ((A AND NOT B) -> NAND(A, C))}
     */
    @Override
    public String toString() {
        return switch (type) {
            case VARIABLE -> variable.toString();
            case CONSTANT -> value ? "TRUE" : "FALSE";
            case NOT -> "NOT " + operand;
            case NAND, NOR -> type.name() + "(" + left + ", " + right + ")";
            case AND, OR, XOR -> "(" + left + " " + type.name() + " " + right + ")";
            case IMPLIES -> "(" + left + " -> " + right + ")";
            case EQUIV -> "(" + left + " <-> " + right + ")";
        };
    }

    //endregion
}
