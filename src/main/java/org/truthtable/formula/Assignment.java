package org.truthtable.formula;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * ASSEGNAMENTO - Valore booleano per ciascuna variabile di una riga
 *
 * Mappa immutabile Variabile -> valore, ordinata alfabeticamente. Il generatore
 * della tabella costruisce un assegnamento totale per ogni riga enumerata.
 */
public final class Assignment {

    private final SortedMap<Variable, Boolean> values;

    /**
     * Costruisce l'assegnamento copiando la mappa fornita.
     *
     * @param values valori delle variabili (non null, senza chiavi o valori null)
     * @throws IllegalArgumentException se la mappa è null o contiene elementi null
     */
    public Assignment(Map<Variable, Boolean> values) {
        if (values == null) {
            throw new IllegalArgumentException("Mappa dei valori non può essere null");
        }
        // containsKey(null) non è ammesso dalle mappe immutabili: si scorrono le voci
        for (Map.Entry<Variable, Boolean> entry : values.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("Assegnamento non può contenere variabili o valori null");
            }
        }
        this.values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    /**
     * Costruisce l'assegnamento associando posizionalmente variabili e valori.
     *
     * @param variables variabili nell'ordine della tabella
     * @param rowValues valori della riga, stessa lunghezza di variables
     * @return assegnamento corrispondente
     * @throws IllegalArgumentException se le lunghezze non coincidono
     */
    public static Assignment of(List<Variable> variables, boolean[] rowValues) {
        if (variables.size() != rowValues.length) {
            throw new IllegalArgumentException("Numero di valori (" + rowValues.length +
                    ") diverso dal numero di variabili (" + variables.size() + ")");
        }

        Map<Variable, Boolean> map = new TreeMap<>();
        for (int i = 0; i < rowValues.length; i++) {
            map.put(variables.get(i), rowValues[i]);
        }
        return new Assignment(map);
    }

    /**
     * @return true se la variabile ha un valore assegnato
     */
    public boolean isAssigned(Variable variable) {
        return values.containsKey(variable);
    }

    /**
     * @return valore assegnato, oppure null se la variabile non è coperta
     */
    public Boolean valueOf(Variable variable) {
        return values.get(variable);
    }

    /**
     * @return vista immutabile dei valori in ordine alfabetico
     */
    public SortedMap<Variable, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return values.equals(((Assignment) obj).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Assignment" + values;
    }
}
