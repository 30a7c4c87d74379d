package com.minislaq.executor;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.minislaq.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a query result as text
 *
 * TABLE:
 * <pre>
 * status | COUNT()
 * -------+--------
 * 200    | 2
 *
 * Total: 1 rows
 * </pre>
 * CSV: header line and one line per row; values containing a comma, a quote
 * or a line break are quoted with inner quotes doubled.
 *
 * JSON: {"count": n, "columns": [...], "rows": [[...], ...]} with numbers and
 * booleans typed and timestamps as ISO-8601 strings.
 *
 * @author Mini-SLAQ
 */
public class ResultFormatter {

    public static final String NO_RESULTS = "No results found.";

    private final Gson gson = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .setPrettyPrinting()
            .create();

    public String format(QueryResult result, OutputFormat format) {
        switch (format) {
            case TABLE:
                return formatAsTable(result);
            case CSV:
                return formatAsCsv(result);
            case JSON:
                return formatAsJson(result);
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    // ==================== Table ====================

    public String formatAsTable(QueryResult result) {
        if (result.isEmpty()) {
            return NO_RESULTS;
        }

        List<String> columns = result.getColumns();
        int[] widths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            widths[i] = columns.get(i).length();
        }
        List<List<String>> cells = new ArrayList<>(result.getCount());
        for (List<Value> row : result.getRows()) {
            List<String> line = new ArrayList<>(row.size());
            for (int i = 0; i < row.size(); i++) {
                String text = row.get(i).asText();
                widths[i] = Math.max(widths[i], text.length());
                line.add(text);
            }
            cells.add(line);
        }

        StringBuilder output = new StringBuilder();
        appendTableLine(output, columns, widths);

        for (int i = 0; i < widths.length; i++) {
            if (i > 0) output.append("-+-");
            output.append(repeat('-', widths[i]));
        }
        output.append('\n');

        for (List<String> line : cells) {
            appendTableLine(output, line, widths);
        }

        output.append('\n').append("Total: ").append(result.getCount()).append(" rows\n");
        return output.toString();
    }

    private static void appendTableLine(StringBuilder output, List<String> cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) line.append(" | ");
            line.append(cells.get(i));
            line.append(repeat(' ', widths[i] - cells.get(i).length()));
        }
        // no trailing padding after the last column
        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == ' ') {
            end--;
        }
        output.append(line, 0, end).append('\n');
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(Math.max(count, 0));
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    // ==================== CSV ====================

    public String formatAsCsv(QueryResult result) {
        StringBuilder output = new StringBuilder();

        List<String> header = new ArrayList<>(result.getColumns().size());
        for (String column : result.getColumns()) {
            header.add(escapeCsv(column));
        }
        output.append(String.join(",", header)).append('\n');

        for (List<Value> row : result.getRows()) {
            List<String> line = new ArrayList<>(row.size());
            for (Value value : row) {
                line.add(escapeCsv(value.asText()));
            }
            output.append(String.join(",", line)).append('\n');
        }
        return output.toString();
    }

    static String escapeCsv(String text) {
        boolean quote = text.indexOf(',') >= 0 || text.indexOf('"') >= 0
                || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
        if (!quote) {
            return text;
        }
        return "\"" + text.replace("\"", "\"\"") + "\"";
    }

    // ==================== JSON ====================

    public String formatAsJson(QueryResult result) {
        return gson.toJson(toJson(result));
    }

    /**
     * JSON tree of a result, shared with the IPC responses
     */
    public JsonObject toJson(QueryResult result) {
        JsonObject json = new JsonObject();
        json.addProperty("count", result.getCount());

        JsonArray columns = new JsonArray();
        for (String column : result.getColumns()) {
            columns.add(column);
        }
        json.add("columns", columns);

        JsonArray rows = new JsonArray();
        for (List<Value> row : result.getRows()) {
            JsonArray line = new JsonArray();
            for (Value value : row) {
                line.add(toJson(value));
            }
            rows.add(line);
        }
        json.add("rows", rows);
        return json;
    }

    static JsonElement toJson(Value value) {
        switch (value.getType()) {
            case STRING:
                return new JsonPrimitive(value.asString());
            case INTEGER:
                return new JsonPrimitive(value.asLong());
            case FLOAT:
                return new JsonPrimitive(value.asDouble());
            case BOOLEAN:
                return new JsonPrimitive(value.asBoolean());
            case TIMESTAMP:
                return new JsonPrimitive(value.asTimestamp().toString());
            case LIST:
                JsonArray array = new JsonArray();
                for (Value element : value.asList()) {
                    array.add(toJson(element));
                }
                return array;
            default:
                throw new IllegalStateException("Unhandled value type: " + value.getType());
        }
    }
}
