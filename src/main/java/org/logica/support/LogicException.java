package org.logica.support;

/**
 * Radice della gerarchia di eccezioni del motore logico.
 *
 * Tutte le eccezioni specifiche del dominio (arità errate, conversioni non
 * rappresentabili, operatori con comportamento non definito, uso di risorse del
 * solutore già rilasciate, errori di sintassi) sono unchecked: segnalano violazioni
 * di precondizioni e non vengono mai usate per il controllo di flusso.
 */
public class LogicException extends RuntimeException {

    public LogicException(String message) {
        super(message);
    }

    public LogicException(String message, Throwable cause) {
        super(message, cause);
    }
}
