package com.minislaq.ipc;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * IPC request, one JSON object per line
 *
 * <pre>
 * {"id": "1", "action": "query", "logFile": "access.log", "query": "SELECT ..."}
 * </pre>
 *
 * @author Mini-SLAQ
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IpcRequest {

    public static final String ACTION_QUERY = "query";
    public static final String ACTION_GET_STATUS = "getStatus";

    private String id;
    private String action;
    private String logFile;
    private String query;
}
