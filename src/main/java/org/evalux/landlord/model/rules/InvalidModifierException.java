package org.evalux.landlord.model.rules;

/** Modificateur hors domaine passé au calcul des points : erreur de programmation de l'appelant. */
public class InvalidModifierException extends IllegalArgumentException {
    public InvalidModifierException(String message) {
        super(message);
    }
}
