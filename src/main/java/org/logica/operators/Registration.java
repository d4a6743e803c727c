package org.logica.operators;

import java.util.List;

/**
 * Esito della registrazione di un operatore personalizzato.
 *
 * Le proprietà non scoperte (nessun duale tra gli operatori registrati, converso
 * assente, proprietà indecidibili) sono elencate in {@code warnings}.
 *
 * @param operator operatore appena registrato
 * @param properties proprietà verificate
 * @param warnings descrizioni delle proprietà non scoperte
 */
public record Registration(CustomOperator operator, OperatorProperties properties, List<String> warnings) {

    public Registration {
        warnings = List.copyOf(warnings);
    }

    /** Vero se tutte le proprietà sono state scoperte. */
    public boolean isComplete() {
        return warnings.isEmpty();
    }
}
