package com.arxlang.ir.pass;

import com.arxlang.ir.ssa.IrModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 降级之后、输出之前执行的固定 pass 序列。不做任何优化。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<IrPass> passes = new ArrayList<>();

    /**
     * 默认管线：封闭不可达块，然后校验模块。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new UnreachableBlockSealing());
        pipeline.addPass(new ModuleVerification());
        return pipeline;
    }

    public void addPass(IrPass pass) {
        passes.add(pass);
    }

    public List<IrPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public IrModule run(IrModule module) {
        for (IrPass pass : passes) {
            LOG.fine("Running pass " + pass.getName());
            module = pass.run(module);
        }
        return module;
    }
}
