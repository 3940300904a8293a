package org.jsondelta.value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Bottom-up fold over a document; container callbacks receive the already-folded children.
 */
public interface JsonFolder<R> {
    R onNull();

    R onBoolean(boolean value);

    R onNumber(BigDecimal value);

    R onString(String value);

    R onObject(JsonObject source, Map<String, R> fields);

    R onArray(JsonArray source, List<R> elements);
}
