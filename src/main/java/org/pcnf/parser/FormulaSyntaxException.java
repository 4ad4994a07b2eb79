package org.pcnf.parser;

/**
 * Formula testuale non conforme alla grammatica.
 * Unico errore di input della pipeline: porta con sé il frammento che ha
 * impedito il riconoscimento.
 */
public class FormulaSyntaxException extends IllegalArgumentException {

    /** Sottostringa che il parser non è riuscito a riconoscere */
    private final String fragment;

    public FormulaSyntaxException(String fragment) {
        this("Espressione non valida: '" + fragment + "'", fragment);
    }

    public FormulaSyntaxException(String message, String fragment) {
        super(message);
        this.fragment = fragment;
    }

    public String getFragment() {
        return fragment;
    }
}
