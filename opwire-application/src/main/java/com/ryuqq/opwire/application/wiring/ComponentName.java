package com.ryuqq.opwire.application.wiring;

/**
 * Unique name of a component in a wiring plan.
 *
 * <p><strong>Validation:</strong></p>
 * <ul>
 *   <li>not null or blank</li>
 *   <li>length 1 to 255</li>
 *   <li>alphanumerics, hyphen, underscore and dot only</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class ComponentName {

    private final String value;

    private ComponentName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ComponentName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ComponentName length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException(
                "ComponentName contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed"
            );
        }
        this.value = value;
    }

    public static ComponentName of(String value) {
        return new ComponentName(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComponentName that = (ComponentName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
