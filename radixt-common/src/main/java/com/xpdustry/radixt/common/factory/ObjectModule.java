package com.xpdustry.radixt.common.factory;

@FunctionalInterface
public interface ObjectModule {

    void configure(final ObjectBinder binder);
}
