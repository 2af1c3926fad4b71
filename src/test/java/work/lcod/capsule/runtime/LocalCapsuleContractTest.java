package work.lcod.capsule.runtime;

import work.lcod.capsule.api.Capsule;
import work.lcod.capsule.support.CapsuleContract;

class LocalCapsuleContractTest extends CapsuleContract {
    @Override
    protected Capsule create(CapsuleDefinition definition) {
        return new CapsuleCore(definition);
    }
}
