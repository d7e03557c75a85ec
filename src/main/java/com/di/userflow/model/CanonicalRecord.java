package com.di.userflow.model;

import java.util.List;

/**
 * Normalized user record produced by the extractor and carried by value through one run.
 *
 * <p>Every field is required and non-blank; construction fails otherwise. {@code username}
 * is the destination key.
 */
public record CanonicalRecord(
        String firstName,
        String lastName,
        String country,
        String username,
        String password
) {

    /** Canonical field names, in the order used by the staging row and the destination table. */
    public static final List<String> FIELDS =
            List.of("username", "firstName", "lastName", "country", "password");

    public CanonicalRecord {
        requireText(firstName, "firstName");
        requireText(lastName, "lastName");
        requireText(country, "country");
        requireText(username, "username");
        requireText(password, "password");
    }

    /** Destination key. */
    public String key() {
        return username;
    }

    /**
     * Returns the value of a canonical field by name.
     *
     * @throws IllegalArgumentException for an unknown field name
     */
    public String field(String name) {
        switch (name) {
            case "username":  return username;
            case "firstName": return firstName;
            case "lastName":  return lastName;
            case "country":   return country;
            case "password":  return password;
            default:
                throw new IllegalArgumentException("Unknown canonical field: " + name);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Canonical field '" + field + "' is missing or empty");
        }
    }

    @Override
    public String toString() {
        return "CanonicalRecord[username=" + username
                + ", firstName=" + firstName
                + ", lastName=" + lastName
                + ", country=" + country
                + ", password=****]";
    }
}
