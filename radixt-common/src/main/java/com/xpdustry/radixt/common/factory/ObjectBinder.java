package com.xpdustry.radixt.common.factory;

import org.jspecify.annotations.Nullable;

public interface ObjectBinder {

    <T> BindingBuilder<T> bind(final Class<T> type);

    interface BindingBuilder<T> {

        BindingBuilder<T> named(final @Nullable String name);

        /**
         * Binds to a class that is instantiated on each lookup.
         */
        void toImpl(final Class<? extends T> impl);

        /**
         * Binds to a class that is instantiated once per factory.
         */
        void toSingleton(final Class<? extends T> impl);

        void toInst(final T inst);
    }
}
