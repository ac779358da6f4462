package hotreload.synth;

import hotreload.diff.CallGraphIndex;
import hotreload.diff.DiffEngine;
import hotreload.diff.ModuleDiff;
import hotreload.module.ClassNodes;
import hotreload.module.CompiledModule;
import hotreload.module.FieldKey;
import hotreload.module.MethodKey;
import hotreload.snapshot.ModuleSnapshot;
import hotreload.testing.SourceTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PatchSynthesizer")
class PatchSynthesizerTest {

    private static final String CART = "shop/Cart";
    private static final String PATCH_CLASS = "shop/Cart$$HotPatch$1";
    private static final MethodKey TOTAL = new MethodKey(CART, "total", "()I");

    private static final String ORIGINAL = """
            package shop;
            public class Cart {
                private int items = 3;
                public int total() { return items * 2; }
                public static String tag(String prefix) { return prefix + "-cart"; }
            }
            """;

    @TempDir
    Path tempDir;

    private SourceTree tree;
    private Path cartFile;
    private CompiledModule baseline;
    private PatchSynthesizer synthesizer;

    @BeforeEach
    void setUp() throws Exception {
        tree = new SourceTree(tempDir, "app");
        cartFile = tree.write("shop/Cart.java", ORIGINAL);
        baseline = tree.compile();
        synthesizer = new PatchSynthesizer(getClass().getClassLoader());
    }

    private ModuleDiff edit(String source) throws Exception {
        tree.write("shop/Cart.java", source);
        CallGraphIndex callGraph = new CallGraphIndex();
        callGraph.index(baseline);
        return new DiffEngine(true).diff(ModuleSnapshot.initial(baseline), baseline, tree.compile(),
                List.of(cartFile), callGraph);
    }

    private PatchNaming naming(long sequence) {
        return new PatchNaming("app", sequence, tempDir.resolve("app-patch-" + sequence + ".jar"));
    }

    private static MethodNode method(PatchModule patch, String owner, String name) {
        ClassNode node = ClassNodes.read(patch.classes().get(owner));
        return node.methods.stream().filter(m -> m.name.equals(name)).findFirst().orElseThrow();
    }

    private static List<MethodInsnNode> calls(MethodNode method) {
        List<MethodInsnNode> calls = new ArrayList<>();
        for (AbstractInsnNode insn : method.instructions) {
            if (insn instanceof MethodInsnNode call) calls.add(call);
        }
        return calls;
    }

    @Nested
    @DisplayName("wrappers")
    class Wrappers {

        @Test
        @DisplayName("turn a modified instance method into a static wrapper taking the receiver first")
        void modifiedInstanceMethod() throws Exception {
            ModuleDiff diff = edit(ORIGINAL.replace("items * 2", "items * 5"));

            PatchModule patch = synthesizer.synthesize(diff, baseline, new PatchLedger(), naming(1));

            assertThat(patch.failures()).isEmpty();
            assertThat(patch.classes()).containsOnlyKeys(PATCH_CLASS);
            assertThat(patch.hosts()).containsEntry(PATCH_CLASS, CART);
            assertThat(patch.methods()).singleElement().satisfies(m -> {
                assertThat(m.original()).isEqualTo(TOTAL);
                assertThat(m.kind()).isEqualTo(WrapperKind.MODIFIED);
                assertThat(m.wrapper()).isEqualTo(new WrapperRef(PATCH_CLASS, "total", "(Lshop/Cart;)I", 1,
                        naming(1).jarPath()));
            });
            MethodNode wrapper = method(patch, PATCH_CLASS, "total");
            assertThat(ClassNodes.isStatic(wrapper.access)).isTrue();
        }

        @Test
        @DisplayName("keep the descriptor of a modified static method")
        void modifiedStaticMethod() throws Exception {
            ModuleDiff diff = edit(ORIGINAL.replace("-cart", "-basket"));

            PatchModule patch = synthesizer.synthesize(diff, baseline, new PatchLedger(), naming(1));

            assertThat(patch.methods()).extracting(PatchedMethod::wrapper)
                    .extracting(WrapperRef::descriptor)
                    .containsExactly("(Ljava/lang/String;)Ljava/lang/String;");
        }

        @Test
        @DisplayName("route calls to an added method to its wrapper")
        void callsToAddedMethod() throws Exception {
            ModuleDiff diff = edit("""
                    package shop;
                    public class Cart {
                        private int items = 3;
                        public int total() { return items * 2 + bonus(); }
                        int bonus() { return 7; }
                        public static String tag(String prefix) { return prefix + "-cart"; }
                    }
                    """);

            PatchModule patch = synthesizer.synthesize(diff, baseline, new PatchLedger(), naming(1));

            assertThat(patch.methods()).extracting(PatchedMethod::kind)
                    .containsExactlyInAnyOrder(WrapperKind.ADDED, WrapperKind.MODIFIED);
            assertThat(calls(method(patch, PATCH_CLASS, "total")))
                    .anySatisfy(call -> {
                        assertThat(call.owner).isEqualTo(PATCH_CLASS);
                        assertThat(call.name).isEqualTo("bonus");
                        assertThat(call.desc).isEqualTo("(Lshop/Cart;)I");
                    });
        }

        @Test
        @DisplayName("call an added method of an earlier patch through the ledger")
        void ledgerWrapper() throws Exception {
            MethodKey bonus = new MethodKey(CART, "bonus", "()I");
            WrapperRef earlier = new WrapperRef("shop/Cart$$HotPatch$1", "bonus", "(Lshop/Cart;)I", 1,
                    naming(1).jarPath());
            PatchLedger ledger = new PatchLedger();
            ledger.record(bonus, earlier);
            ModuleDiff diff = edit("""
                    package shop;
                    public class Cart {
                        private int items = 3;
                        public int total() { return items * 2 + bonus(); }
                        int bonus() { return 7; }
                        public static String tag(String prefix) { return prefix + "-cart"; }
                    }
                    """);

            // bonus() is unchanged since the snapshot that added it
            PatchModule patch = synthesizer.synthesize(withoutMember(diff, bonus), baseline, ledger, naming(2));

            assertThat(patch.requires()).containsExactly(naming(1).jarPath());
            assertThat(calls(method(patch, "shop/Cart$$HotPatch$2", "total")))
                    .anySatisfy(call -> assertThat(call.owner).isEqualTo("shop/Cart$$HotPatch$1"));
        }
    }

    private ModuleDiff withoutMember(ModuleDiff diff, MethodKey key) throws Exception {
        CompiledModule withBonus = diff.candidate();
        CallGraphIndex callGraph = new CallGraphIndex();
        callGraph.index(withBonus);
        tree.write("shop/Cart.java", """
                package shop;
                public class Cart {
                    private int items = 3;
                    public int total() { return items * 3 + bonus(); }
                    int bonus() { return 7; }
                    public static String tag(String prefix) { return prefix + "-cart"; }
                }
                """);
        ModuleDiff next = new DiffEngine(true).diff(ModuleSnapshot.initial(baseline).next(withBonus), baseline,
                tree.compile(), List.of(cartFile), callGraph);
        assertThat(next.type(CART).touches(key)).isFalse();
        return next;
    }

    @Nested
    @DisplayName("added fields")
    class AddedFieldInitializers {

        @Test
        @DisplayName("register literal initializers in the patch class initializer")
        void literalInitializer() throws Exception {
            ModuleDiff diff = edit("""
                    package shop;
                    public class Cart {
                        private int items = 3;
                        private int limit = 5;
                        public int total() { return items * 2 + limit; }
                        public static String tag(String prefix) { return prefix + "-cart"; }
                    }
                    """);

            PatchModule patch = synthesizer.synthesize(diff, baseline, new PatchLedger(), naming(1));

            assertThat(patch.failures()).isEmpty();
            assertThat(patch.initializers())
                    .containsExactly(new FieldInitializer(new FieldKey(CART, "limit", "I"), 5));
            assertThat(method(patch, PATCH_CLASS, "<clinit>")).isNotNull();
            assertThat(calls(method(patch, PATCH_CLASS, "total")))
                    .anySatisfy(call -> assertThat(call.owner).isEqualTo("hotreload/runtime/AddedFields"));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("leave out a new type that cannot be defined and every member using it")
        void failurePropagates() throws Exception {
            Path freshFile = tree.write("fresh/Promo.java", """
                    package fresh;
                    public class Promo {
                        public static int percent() { return 10; }
                    }
                    """);
            tree.write("shop/Cart.java", """
                    package shop;
                    public class Cart {
                        private int items = 3;
                        public int total() { return items * 2 - fresh.Promo.percent(); }
                        public static String tag(String prefix) { return prefix + "-sale"; }
                    }
                    """);
            CallGraphIndex callGraph = new CallGraphIndex();
            callGraph.index(baseline);
            ModuleDiff diff = new DiffEngine(true).diff(ModuleSnapshot.initial(baseline), baseline, tree.compile(),
                    List.of(cartFile, freshFile), callGraph);

            PatchModule patch = synthesizer.synthesize(diff, baseline, new PatchLedger(), naming(1));

            assertThat(patch.failures()).extracting(SynthesisFailure::target)
                    .contains("fresh.Promo", TOTAL.fullName());
            assertThat(patch.methods()).extracting(PatchedMethod::original)
                    .containsExactly(new MethodKey(CART, "tag", "(Ljava/lang/String;)Ljava/lang/String;"));
            assertThat(patch.newTypes()).isEmpty();
            assertThat(patch.hasFailures()).isTrue();
        }
    }

    @Nested
    @DisplayName("new types")
    class NewTypes {

        @Test
        @DisplayName("define a new type of a loaded package and call it directly")
        void newTypeInLoadedPackage() throws Exception {
            Path couponFile = tree.write("shop/Coupon.java", """
                    package shop;
                    public class Coupon {
                        private final int off;
                        public Coupon(int off) { this.off = off; }
                        public int apply(int total) { return total - off; }
                    }
                    """);
            tree.write("shop/Cart.java", ORIGINAL.replace("items * 2", "new Coupon(1).apply(items * 2)"));
            CallGraphIndex callGraph = new CallGraphIndex();
            callGraph.index(baseline);
            ModuleDiff diff = new DiffEngine(true).diff(ModuleSnapshot.initial(baseline), baseline, tree.compile(),
                    List.of(cartFile, couponFile), callGraph);

            PatchModule patch = synthesizer.synthesize(diff, baseline, new PatchLedger(), naming(1));

            assertThat(patch.failures()).isEmpty();
            assertThat(patch.newTypes()).containsExactly("shop/Coupon");
            assertThat(patch.newTypeClasses()).containsOnlyKeys("shop/Coupon");
            assertThat(patch.hosts()).containsEntry("shop/Coupon", CART);
        }
    }

    @Test
    @DisplayName("produces byte-identical output for identical inputs")
    void deterministic() throws Exception {
        ModuleDiff diff = edit("""
                package shop;
                import java.util.function.IntSupplier;
                public class Cart {
                    private int items = 3;
                    private int limit = 5;
                    public int total() { IntSupplier s = () -> items + bonus() + limit; return s.getAsInt(); }
                    int bonus() { return 7; }
                    public static String tag(String prefix) { return prefix + "-cart"; }
                }
                """);

        PatchModule first = synthesizer.synthesize(diff, baseline, new PatchLedger(), naming(1));
        PatchModule second = new PatchSynthesizer(getClass().getClassLoader())
                .synthesize(diff, baseline, new PatchLedger(), naming(1));

        assertThat(first.failures()).isEmpty();
        assertThat(second.classes().keySet()).isEqualTo(first.classes().keySet());
        for (String name : first.classes().keySet()) {
            assertThat(second.classes().get(name)).as(name).isEqualTo(first.classes().get(name));
        }
        assertThat(second.methods()).isEqualTo(first.methods());
    }
}
