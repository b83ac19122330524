package org.truthtable.formula;

/**
 * VARIABILE PROPOSIZIONALE - Identificatore di una singola lettera maiuscola
 *
 * Rappresenta una variabile booleana della formula. L'identità coincide con la
 * lettera (A-Z): uguaglianza, hash e ordinamento dipendono solo da essa, così
 * che l'insieme delle variabili di una formula sia ordinabile alfabeticamente.
 *
 * INVARIANTI:
 * • Nome sempre composto da una sola lettera nell'intervallo A-Z
 * • Istanza immutabile, condivisibile liberamente tra tabelle e mappe
 */
public final class Variable implements Comparable<Variable> {

    /** Lettera che identifica la variabile */
    private final char name;

    //region COSTRUZIONE CON VALIDAZIONE

    /**
     * Costruisce la variabile validando la lettera.
     *
     * @param name lettera maiuscola A-Z
     * @throws IllegalArgumentException se il carattere non è una lettera maiuscola
     */
    public Variable(char name) {
        if (name < 'A' || name > 'Z') {
            throw new IllegalArgumentException("Nome variabile deve essere una lettera A-Z, ricevuto: '" + name + "'");
        }
        this.name = name;
    }

    /**
     * Costruisce la variabile da una stringa di un solo carattere.
     *
     * @param name stringa di lunghezza 1 (le minuscole vengono normalizzate)
     * @return variabile corrispondente
     * @throws IllegalArgumentException se la stringa non è una singola lettera
     */
    public static Variable of(String name) {
        if (name == null || name.length() != 1) {
            throw new IllegalArgumentException("Nome variabile deve essere una singola lettera, ricevuto: " + name);
        }
        return new Variable(Character.toUpperCase(name.charAt(0)));
    }

    //endregion

    //region ACCESSORS

    /**
     * @return lettera della variabile
     */
    public char getName() {
        return name;
    }

    //endregion

    //region UGUAGLIANZA E ORDINAMENTO

    @Override
    public int compareTo(Variable other) {
        return Character.compare(name, other.name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return name == ((Variable) obj).name;
    }

    @Override
    public int hashCode() {
        return Character.hashCode(name);
    }

    @Override
    public String toString() {
        return String.valueOf(name);
    }

    //endregion
}
