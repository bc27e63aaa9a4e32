package infra.input;

import com.fasterxml.jackson.databind.JsonNode;

final class JsonFields {

    private JsonFields() {
    }

    /** First non-null field among {@code names}, as text; "" when none. */
    static String firstText(JsonNode n, String... names) {
        for (String name : names) {
            JsonNode v = n.get(name);
            if (v != null && !v.isNull()) return v.asText("");
        }
        return "";
    }
}
