package work.arachne.config.dsl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.arachne.config.error.ConfigScriptException;

class DslRegistryTest {
    @Test
    void coreFormsAreRegistered() {
        var registry = DslRegistry.withCoreForms();

        for (String name : List.of("entity", "attr", "ref", "depends", "transact")) {
            assertSame(registry.get(CoreDsl.NAMESPACE + "/" + name), registry.get(name));
        }
    }

    @Test
    void conflictingSimpleNamesNeedQualification() {
        var registry = DslRegistry.withCoreForms();
        registry.register(DslFunction.define("other/entity", "", ArgSpec.none(), args -> "other"));

        assertNull(registry.get("entity"));
        assertEquals("other", registry.invoke("other/entity", List.of()));
        assertTrue(registry.names().contains("arachne.core/entity"));
    }

    @Test
    void unregisteringAConflictRestoresTheSimpleName() {
        var registry = DslRegistry.withCoreForms();
        registry.register(DslFunction.define("other/entity", "", ArgSpec.none(), args -> "other"));
        registry.register(DslFunction.define("third/entity", "", ArgSpec.none(), args -> "third"));

        registry.unregister("other/entity");
        assertNull(registry.get("entity"));

        registry.unregister("third/entity");
        assertSame(registry.get(CoreDsl.NAMESPACE + "/entity"), registry.get("entity"));
        assertTrue(registry.names().contains("entity"));
    }

    @Test
    void unknownFormsFailWithCode() {
        var ex = assertThrows(ConfigScriptException.class, () -> DslRegistry.withCoreForms().require("nope"));
        assertEquals("unknown-dsl-function", ex.code());
    }

    @Test
    void unregisterRemovesBothNames() {
        var registry = new DslRegistry();
        registry.register(DslFunction.define("x/only", "", ArgSpec.none(), args -> null));
        registry.unregister("x/only");

        assertNull(registry.get("only"));
        assertTrue(registry.entries().isEmpty());
    }
}
