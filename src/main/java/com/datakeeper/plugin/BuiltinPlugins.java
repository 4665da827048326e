package com.datakeeper.plugin;

import com.datakeeper.operation.downsampling.DataDownSamplingOperation;
import com.datakeeper.operation.retention.DataReductionOperation;
import com.datakeeper.policy.DownsamplerPolicy;
import com.datakeeper.policy.RetentionPolicy;
import com.datakeeper.strategy.DefaultStrategy;

import java.util.List;

/**
 * Registration functions of the plugins shipped with datakeeper, in registration order.
 */
public final class BuiltinPlugins {

    private static final List<PluginModule> MODULES = List.of(
            DefaultStrategy::register,
            DataReductionOperation::register,
            DataDownSamplingOperation::register,
            RetentionPolicy::register,
            DownsamplerPolicy::register
    );

    private BuiltinPlugins() {
    }

    public static List<PluginModule> modules() {
        return MODULES;
    }
}
