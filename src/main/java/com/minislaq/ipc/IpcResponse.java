package com.minislaq.ipc;

import com.google.gson.JsonObject;
import lombok.Getter;

/**
 * IPC response
 *
 * Absent fields are left out of the JSON: data only on success, error
 * only on failure.
 *
 * @author Mini-SLAQ
 */
@Getter
public class IpcResponse {

    private final String id;
    private final boolean success;
    private final JsonObject data;
    private final String error;

    private IpcResponse(String id, boolean success, JsonObject data, String error) {
        this.id = id;
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static IpcResponse ok(String id, JsonObject data) {
        return new IpcResponse(id, true, data, null);
    }

    public static IpcResponse failure(String id, String error) {
        return new IpcResponse(id, false, null, error);
    }
}
