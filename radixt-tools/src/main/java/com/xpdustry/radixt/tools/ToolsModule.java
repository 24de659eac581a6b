package com.xpdustry.radixt.tools;

import com.xpdustry.radixt.common.factory.ObjectBinder;
import com.xpdustry.radixt.common.factory.ObjectModule;
import com.xpdustry.radixt.tools.lifecycle.ExitService;
import com.xpdustry.radixt.tools.lifecycle.SystemExitService;
import com.xpdustry.radixt.tools.line.ContainerKind;
import com.xpdustry.radixt.tools.line.CountingLineCollector;
import com.xpdustry.radixt.tools.line.HashLineCollector;
import com.xpdustry.radixt.tools.line.LineCollector;
import com.xpdustry.radixt.tools.line.RadixLineCollector;
import com.xpdustry.radixt.tools.line.TreeLineCollector;

public record ToolsModule(ToolConfig config) implements ObjectModule {

    @Override
    public void configure(final ObjectBinder binder) {
        binder.bind(ToolConfig.class).toInst(this.config);
        binder.bind(ExitService.class).toSingleton(SystemExitService.class);
        binder.bind(LineCollector.class).named(ContainerKind.RADIX.id()).toImpl(RadixLineCollector.class);
        binder.bind(LineCollector.class).named(ContainerKind.HASH.id()).toImpl(HashLineCollector.class);
        binder.bind(LineCollector.class).named(ContainerKind.BTREE.id()).toImpl(TreeLineCollector.class);
        binder.bind(LineCollector.class).named(ContainerKind.COUNT.id()).toImpl(CountingLineCollector.class);
    }
}
