package io.github.eutro.livevars.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another {@link ExtContainer}
 * for exts it does not hold itself.
 * <p>
 * Instructions delegate to their operation, and operations to their key,
 * which is how an {@link io.github.eutro.livevars.core.ops.InsnKind} attached
 * once to a key is visible from every instruction using it.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to fall back to.
     *
     * @return The delegate, or null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        ExtContainer delegate = getDelegate();
        if (delegate != null) return delegate.getNullable(ext);
        return null;
    }
}
