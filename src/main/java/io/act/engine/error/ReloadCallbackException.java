package io.act.engine.error;

public final class ReloadCallbackException extends ActEngineException {
    public ReloadCallbackException(String callback, Throwable cause) {
        super("reload_callback", "Reload callback '" + callback + "' failed: " + cause.getMessage(), cause);
    }
}
