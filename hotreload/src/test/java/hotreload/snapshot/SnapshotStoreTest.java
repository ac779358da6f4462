package hotreload.snapshot;

import hotreload.module.CompiledModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SnapshotStore")
class SnapshotStoreTest {

    private SnapshotStore store;
    private CompiledModule baseline;

    private static byte[] emptyClass(String internalName) {
        ClassWriter cw = new ClassWriter(0);
        cw.visit(Opcodes.V17, Opcodes.ACC_PUBLIC, internalName, null, "java/lang/Object", null);
        cw.visitEnd();
        return cw.toByteArray();
    }

    private static byte[] classWithField(String internalName, String field) {
        ClassWriter cw = new ClassWriter(0);
        cw.visit(Opcodes.V17, Opcodes.ACC_PUBLIC, internalName, null, "java/lang/Object", null);
        cw.visitField(Opcodes.ACC_PRIVATE, field, "I", null, null).visitEnd();
        cw.visitEnd();
        return cw.toByteArray();
    }

    @BeforeEach
    void setUp() {
        store = new SnapshotStore();
        baseline = CompiledModule.fromBytes("app", Map.of("app/Order", emptyClass("app/Order")));
    }

    @Test
    @DisplayName("initialize sets the baseline and a cycle 0 snapshot")
    void initialize() {
        store.initialize(baseline, baseline);

        assertThat(store.contains("app")).isTrue();
        assertThat(store.current("app")).get().extracting(ModuleSnapshot::cycle).isEqualTo(0L);
        assertThat(store.baseline("app")).containsSame(baseline);
        assertThat(store.modules()).containsExactly("app");
    }

    @Test
    @DisplayName("unknown modules have no snapshot")
    void unknownModule() {
        assertThat(store.contains("nope")).isFalse();
        assertThat(store.current("nope")).isEmpty();
        assertThatThrownBy(() -> store.replace("nope", baseline)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("replace advances the snapshot and leaves the baseline")
    void replace() {
        store.initialize(baseline, baseline);
        CompiledModule candidate = baseline.withClasses(Map.of("app/Line", emptyClass("app/Line")));

        ModuleSnapshot next = store.replace("app", candidate);

        assertThat(next.cycle()).isEqualTo(1L);
        assertThat(store.current("app")).get().extracting(ModuleSnapshot::compiled).isSameAs(candidate);
        assertThat(store.baseline("app").orElseThrow().contains("app/Line")).isFalse();
    }

    @Test
    @DisplayName("holdBack restores held types from the replaced snapshot and keeps the cycle")
    void holdBack() {
        store.initialize(baseline, baseline);
        CompiledModule edited = CompiledModule.fromBytes("app", Map.of(
                "app/Order", classWithField("app/Order", "total"),
                "app/Invoice", emptyClass("app/Invoice")));
        store.replace("app", edited);

        Set<String> held = store.holdBack("app", Set.of("app/Order", "app/Invoice"));

        assertThat(held).containsExactly("app/Order");
        ModuleSnapshot current = store.current("app").orElseThrow();
        assertThat(current.cycle()).isEqualTo(1L);
        assertThat(current.compiled().classNode("app/Order").fields).isEmpty();
        assertThat(current.compiled().contains("app/Invoice")).isTrue();
    }

    @Test
    @DisplayName("holdBack does nothing before the first replace")
    void holdBackWithoutEarlierSnapshot() {
        store.initialize(baseline, baseline);

        assertThat(store.holdBack("app", Set.of("app/Order"))).isEmpty();
        assertThat(store.current("app").orElseThrow().compiled()).isSameAs(baseline);
    }

    @Test
    @DisplayName("promoted classes join the baseline")
    void promote() {
        store.initialize(baseline, baseline);

        store.promoteToBaseline("app", Map.of("app/Coupon", emptyClass("app/Coupon")));

        CompiledModule promoted = store.baseline("app").orElseThrow();
        assertThat(promoted.contains("app/Coupon")).isTrue();
        assertThat(promoted.contains("app/Order")).isTrue();
    }

    @Test
    @DisplayName("modules lock independently")
    void independentLocks() throws Exception {
        ReentrantLock app = store.lockFor("app");
        assertThat(store.lockFor("app")).isSameAs(app);
        app.lock();
        try {
            AtomicBoolean acquired = new AtomicBoolean();
            CountDownLatch done = new CountDownLatch(1);
            Thread other = new Thread(() -> {
                ReentrantLock billing = store.lockFor("billing");
                acquired.set(billing.tryLock());
                if (acquired.get()) billing.unlock();
                done.countDown();
            });
            other.start();

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(acquired).isTrue();
        } finally {
            app.unlock();
        }
    }

    @Test
    @DisplayName("clear forgets a module")
    void clear() {
        store.initialize(baseline, baseline);

        store.clear("app");

        assertThat(store.contains("app")).isFalse();
        assertThat(store.baseline("app")).isEmpty();
    }
}
