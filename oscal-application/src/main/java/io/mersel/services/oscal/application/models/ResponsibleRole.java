package io.mersel.services.oscal.application.models;

import java.util.List;

/**
 * {@code responsible-role} elementi.
 *
 * @param name       {@code role-id} attribute değeri
 * @param partyUuids {@code party-uuid} çocuklarının değerleri, belge sırasıyla (boş olabilir)
 */
public record ResponsibleRole(String name, List<String> partyUuids) {

    public ResponsibleRole {
        partyUuids = List.copyOf(partyUuids);
    }
}
