package org.logica.operators;

/**
 * Esito della verifica di una proprietà algebrica (commutatività, associatività).
 * UNDETERMINED quando il catalogo non è in grado di decidere, ad esempio per
 * operatori con arità diversa da due.
 */
public enum PropertyStatus {
    HOLDS,
    FAILS,
    UNDETERMINED
}
