package certflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;

/**
 * Identifies a site in the hosting control plane. Certificate tags carry it in its
 * <code>resourceGroup/appName/slotName</code> text form, see {@link #parse(String)} and {@link #toString()}.
 */
public record SiteRef(
    @NotBlank
    String resourceGroup,
    @NotBlank
    String appName,
    String slotName
) {

    public static final String PRODUCTION_SLOT = "production";

    public SiteRef {
        if (slotName == null || slotName.isBlank()) {
            slotName = PRODUCTION_SLOT;
        }
    }

    @JsonIgnore
    public boolean isProductionSlot() {
        return PRODUCTION_SLOT.equals(slotName);
    }

    public static SiteRef parse(String value) {
        final String[] parts = value.split("/");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Site reference must be resourceGroup/appName[/slotName]: " + value);
        }
        return new SiteRef(parts[0], parts[1], parts.length == 3 ? parts[2] : null);
    }

    @Override
    public String toString() {
        return resourceGroup + "/" + appName + "/" + slotName;
    }
}
