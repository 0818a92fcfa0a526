package org.evalux.landlord.service;

import org.evalux.landlord.model.rules.ValidationError;

/** Annonces invalides : l'utilisateur doit corriger sa saisie, rien n'est enregistré. */
public class BidValidationException extends RuntimeException {
    private final ValidationError error;

    public BidValidationException(ValidationError error) {
        super(error.message());
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }
}
