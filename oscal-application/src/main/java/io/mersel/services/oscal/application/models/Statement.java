package io.mersel.services.oscal.application.models;

/**
 * Kontrol uygulama açıklaması.
 *
 * @param statementId {@code statement-id} attribute değeri
 * @param value       {@code description} altındaki tüm metinlerin birleşimi (markup'sız, trim edilmiş)
 */
public record Statement(String statementId, String value) {
}
