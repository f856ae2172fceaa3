package com.wcagdocs.techniques.model;

/**
 * Technology categories techniques are filed under, with their index titles.
 */
public enum Technology {
    ARIA("aria", "ARIA Techniques"),
    CLIENT_SIDE_SCRIPT("client-side-script", "Client-Side Script Techniques"),
    CSS("css", "CSS Techniques"),
    FAILURES("failures", "Common Failures"),
    // Deprecated in 2020
    FLASH("flash", "Flash Techniques"),
    GENERAL("general", "General Techniques"),
    HTML("html", "HTML Techniques"),
    PDF("pdf", "PDF Techniques"),
    SERVER_SIDE_SCRIPT("server-side-script", "Server-Side Script Techniques"),
    SMIL("smil", "SMIL Techniques"),
    // Deprecated in 2020
    SILVERLIGHT("silverlight", "Silverlight Techniques"),
    TEXT("text", "Plain-Text Techniques");

    private final String directoryName;
    private final String title;

    Technology(String directoryName, String title) {
        this.directoryName = directoryName;
        this.title = title;
    }

    public String getDirectoryName() {
        return directoryName;
    }

    public String getTitle() {
        return title;
    }

    public static Technology fromDirectoryName(String name) {
        for (Technology technology : values()) {
            if (technology.directoryName.equals(name)) {
                return technology;
            }
        }
        throw new IllegalArgumentException("Invalid technology name: " + name);
    }
}
