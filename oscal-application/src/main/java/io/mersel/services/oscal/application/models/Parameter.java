package io.mersel.services.oscal.application.models;

/**
 * {@code set-parameter} elementi.
 *
 * @param paramId {@code param-id} attribute değeri
 * @param value   İlk {@code value} çocuğunun metni
 */
public record Parameter(String paramId, String value) {
}
