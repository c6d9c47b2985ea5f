package work.arachne.config.error;

import java.util.LinkedHashMap;

public final class InvalidTransactionException extends ConfigScriptException {
    public InvalidTransactionException(String reason, Object op) {
        super(ConfigErrors.INVALID_TRANSACTION, data(reason, op));
    }

    private static LinkedHashMap<String, Object> data(String reason, Object op) {
        var data = new LinkedHashMap<String, Object>();
        data.put("reason", reason);
        data.put("op", op);
        return data;
    }
}
