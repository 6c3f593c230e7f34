package io.addresswatcher.engine.event;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Row image of the watched {@code users} table.
 *
 * <p>Field names follow the table's column names as Debezium emits them. Columns added to the
 * table later are ignored.
 *
 * @param id            user identifier (UUID)
 * @param email         login email
 * @param passwordHash  stored password hash, never logged
 * @param phoneNumber   contact phone number
 * @param walletAddress watched wallet address
 * @param subscribed    whether the user receives notifications
 * @param createdAt     creation time
 * @param updatedAt     last modification time
 * @param deletedAt     soft-delete time, null while the user is active
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserRow(
        @JsonProperty("id") String id,
        @JsonProperty("email") String email,
        @JsonProperty("password_hash") String passwordHash,
        @JsonProperty("phone_number") @JsonAlias("phone_no") String phoneNumber,
        @JsonProperty("wallet_address") String walletAddress,
        @JsonProperty("subscribed") boolean subscribed,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("deleted_at") Instant deletedAt) {

    /** True once the row carries a soft-delete timestamp. */
    public boolean isSoftDeleted() {
        return deletedAt != null;
    }

    @Override
    public String toString() {
        return "UserRow{id=" + id
                + ", email=" + email
                + ", passwordHash=***"
                + ", phoneNumber=" + phoneNumber
                + ", walletAddress=" + walletAddress
                + ", subscribed=" + subscribed
                + ", createdAt=" + createdAt
                + ", updatedAt=" + updatedAt
                + ", deletedAt=" + deletedAt + "}";
    }
}
