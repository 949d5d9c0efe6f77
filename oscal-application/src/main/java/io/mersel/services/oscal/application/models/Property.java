package io.mersel.services.oscal.application.models;

/**
 * Kontrol üzerindeki tek bir {@code prop} elementi.
 */
public record Property(String name, String value) {
}
