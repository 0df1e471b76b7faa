package org.carball.placement.model.placement;

public enum PlatformType {
    YANDEX_NETWORK("Yandex placement"),
    DSP("DSP placement"),
    MOBILE_APP("Mobile app"),
    COM_DOMAIN("Site (.com)"),
    GENERIC_SITE("Site");

    private final String displayName;

    PlatformType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
