package io.act.engine.watch;

@FunctionalInterface
public interface ReloadCallback {
    void onReload(ReloadEvent event) throws Exception;
}
