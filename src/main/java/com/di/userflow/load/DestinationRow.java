package com.di.userflow.load;

import com.di.userflow.model.CanonicalRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One row of the destination user table, keyed by {@code username}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DestinationRow {

    private String  username;
    private String  firstName;
    private String  lastName;
    private String  country;

    @ToString.Exclude
    private String  password;

    /** Set by the database when the row is first inserted. */
    private Instant loadedAt;

    /** Builds the row a record is expected to produce (without {@code loadedAt}). */
    public static DestinationRow of(CanonicalRecord record) {
        return DestinationRow.builder()
                .username(record.username())
                .firstName(record.firstName())
                .lastName(record.lastName())
                .country(record.country())
                .password(record.password())
                .build();
    }
}
