package com.xpdustry.radixt.common.factory;

import com.google.common.base.Preconditions;
import com.google.inject.Binder;
import com.google.inject.ConfigurationException;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.Stage;
import com.google.inject.binder.LinkedBindingBuilder;
import com.google.inject.name.Names;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class GuiceObjectFactory implements ObjectFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(GuiceObjectFactory.class);

    private final List<ObjectModule> modules;
    private @Nullable Injector injector = null;

    GuiceObjectFactory(final ObjectModule... modules) {
        this.modules = List.of(modules);
    }

    @Override
    public void initialize() throws ObjectFactoryInitializationException {
        Preconditions.checkState(this.injector == null, "The factory is already initialized");
        try {
            this.injector = Guice.createInjector(Stage.PRODUCTION, new ModuleAdapter(this, this.modules));
        } catch (final CreationException e) {
            throw new ObjectFactoryInitializationException(e);
        }
        LOGGER.debug("Initialized object factory with {} module(s)", this.modules.size());
    }

    @Override
    public <T> T get(final Class<T> type, final @Nullable String name) {
        Preconditions.checkState(this.injector != null, "The factory is not initialized yet");
        final var key = name == null ? Key.get(type) : Key.get(type, Names.named(name));
        try {
            return this.injector.getInstance(key);
        } catch (final ConfigurationException e) {
            throw new IllegalArgumentException("No binding for " + key, e);
        }
    }

    private record ModuleAdapter(ObjectFactory factory, List<ObjectModule> modules) implements Module {

        @Override
        public void configure(final Binder binder) {
            binder.disableCircularProxies();
            binder.bind(ObjectFactory.class).toInstance(this.factory);
            final var adapted = new GuiceObjectBinder(binder);
            for (final var module : this.modules) {
                module.configure(adapted);
            }
        }
    }

    private record GuiceObjectBinder(Binder binder) implements ObjectBinder {

        @Override
        public <T> BindingBuilder<T> bind(final Class<T> type) {
            return new GuiceBindingBuilder<>(this.binder, type);
        }
    }

    private static final class GuiceBindingBuilder<T> implements ObjectBinder.BindingBuilder<T> {

        private final Binder binder;
        private final Class<T> type;
        private @Nullable String name = null;

        private GuiceBindingBuilder(final Binder binder, final Class<T> type) {
            this.binder = binder;
            this.type = type;
        }

        @Override
        public ObjectBinder.BindingBuilder<T> named(final @Nullable String name) {
            this.name = name;
            return this;
        }

        @Override
        public void toImpl(final Class<? extends T> impl) {
            this.builder().to(impl);
        }

        @Override
        public void toSingleton(final Class<? extends T> impl) {
            this.builder().to(impl).in(Scopes.SINGLETON);
        }

        @Override
        public void toInst(final T inst) {
            this.builder().toInstance(inst);
        }

        private LinkedBindingBuilder<T> builder() {
            final var builder = this.binder.bind(this.type);
            return this.name == null ? builder : builder.annotatedWith(Names.named(this.name));
        }
    }
}
