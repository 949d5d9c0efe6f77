package io.mersel.services.oscal.application.models;

import io.mersel.services.oscal.application.enums.ControlOrigination;
import io.mersel.services.oscal.application.enums.ImplementationStatus;

import java.util.List;
import java.util.Optional;

/**
 * Tek bir {@code implemented-requirement} elementinden çıkarılan güvenlik kontrolü.
 * <p>
 * Tüm listeler belge sırasını korur ve oluşturulduktan sonra değiştirilemez.
 * {@code controlId} attribute'taki haliyle saklanır, normalize edilmez.
 *
 * @param controlId        {@code control-id} attribute değeri (zorunlu)
 * @param uuid             {@code uuid} attribute değeri; yoksa {@code null}
 * @param ordinalIndex     Kontrolün kardeşleri arasındaki sıfır tabanlı konumu
 * @param properties       {@code prop} çocukları
 * @param statements       {@code statement} çocukları
 * @param parameters       {@code set-parameter} çocukları
 * @param responsibleRoles {@code responsible-role} çocukları
 */
public record SecurityControl(
        String controlId,
        String uuid,
        int ordinalIndex,
        List<Property> properties,
        List<Statement> statements,
        List<Parameter> parameters,
        List<ResponsibleRole> responsibleRoles
) {

    public SecurityControl {
        if (controlId == null) {
            throw new IllegalArgumentException("controlId zorunludur");
        }
        properties = List.copyOf(properties);
        statements = List.copyOf(statements);
        parameters = List.copyOf(parameters);
        responsibleRoles = List.copyOf(responsibleRoles);
    }

    public boolean hasMultipleResponsibleRoles() {
        return responsibleRoles.size() > 1;
    }

    /**
     * Verilen addaki ilk property'nin değeri.
     */
    public Optional<String> findProperty(String name) {
        return properties.stream()
                .filter(p -> p.name().equals(name))
                .map(Property::value)
                .findFirst();
    }

    public Optional<String> implementationStatus() {
        return findProperty(ImplementationStatus.PROPERTY_NAME);
    }

    public Optional<String> controlOrigination() {
        return findProperty(ControlOrigination.PROPERTY_NAME);
    }
}
