package io.intellixity.polystore.persistence.exec.handle;

/** Handle owned by its provider; a store never closes it. */
public non-sealed interface ExternallyManagedHandle<TClient> extends EngineHandle<TClient> {
}
