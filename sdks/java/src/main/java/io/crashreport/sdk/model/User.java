package io.crashreport.sdk.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The user associated with captured events, such as the currently signed in user.
 *
 * <p>Set it on the client with {@code CrashReportClient#setUserContext(User)} to attach it to
 * every event, or per event with {@link Event.Builder#userContext(User)}. A per-event user
 * replaces the client-level one entirely; fields are never mixed.
 *
 * <p>At a minimum an {@code id} or an {@code ipAddress} must be provided.
 *
 * <pre>{@code
 * "user": {
 *   "id": "unique_id",
 *   "username": "my_user",
 *   "email": "foo@example.com",
 *   "ip_address": "127.0.0.1",
 *   "extras": {"subscription": "basic"}
 * }
 * }</pre>
 */
public final class User {
    private final String id;
    private final String username;
    private final String email;
    private final String ipAddress;
    private final Map<String, Object> extras;

    /**
     * @throws IllegalArgumentException if both {@code id} and {@code ipAddress} are null
     */
    public User(String id, String username, String email, String ipAddress, Map<String, Object> extras) {
        if (id == null && ipAddress == null) {
            throw new IllegalArgumentException("User requires an id or an ipAddress");
        }
        this.id = id;
        this.username = username;
        this.email = email;
        this.ipAddress = ipAddress;
        this.extras = extras != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extras)) : null;
    }

    public static User withId(String id) {
        return new User(id, null, null, null, null);
    }

    public static User withIpAddress(String ipAddress) {
        return new User(null, null, null, ipAddress, null);
    }

    public String getId() { return id; }
    public String getUsername() { return username; }
    public String getEmail() { return email; }
    public String getIpAddress() { return ipAddress; }
    public Map<String, Object> getExtras() { return extras; }

    /** Wire representation; absent fields are left out. */
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        if (id != null) json.put("id", id);
        if (username != null) json.put("username", username);
        if (email != null) json.put("email", email);
        if (ipAddress != null) json.put("ip_address", ipAddress);
        if (extras != null && !extras.isEmpty()) json.put("extras", extras);
        return json;
    }

    @Override
    public String toString() {
        return "User{id=" + id + ", username=" + username + ", ipAddress=" + ipAddress + "}";
    }
}
