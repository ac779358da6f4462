package hotreload.diff;

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

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DiffEngine")
class DiffEngineTest {

    private static final MethodKey TOTAL = new MethodKey("shop/Cart", "total", "()I");

    @TempDir
    Path tempDir;

    private SourceTree tree;
    private Path cartFile;
    private CompiledModule baseline;
    private CallGraphIndex callGraph;

    @BeforeEach
    void setUp() throws Exception {
        tree = new SourceTree(tempDir, "app");
        cartFile = tree.write("shop/Cart.java", """
                package shop;
                public class Cart {
                    private int items = 3;
                    public int total() { return items * 2; }
                    public float rate() { return 2.5f; }
                    public String label() { return "cart"; }
                }
                """);
        baseline = tree.compile();
        callGraph = new CallGraphIndex();
        callGraph.index(baseline);
    }

    private ModuleDiff diffAgainstBaseline(boolean cascade, Path... changed) throws Exception {
        CompiledModule candidate = tree.compile();
        return new DiffEngine(cascade).diff(ModuleSnapshot.initial(baseline), baseline, candidate,
                List.of(changed), callGraph);
    }

    @Nested
    @DisplayName("change detection")
    class ChangeDetection {

        @Test
        @DisplayName("reports a method whose body changed as modified")
        void modifiedBody() throws Exception {
            tree.write("shop/Cart.java", """
                    package shop;
                    public class Cart {
                        private int items = 3;
                        public int total() { return items * 3; }
                        public float rate() { return 2.5f; }
                        public String label() { return "cart"; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, cartFile);

            TypeDiff cart = diff.type("shop/Cart");
            assertThat(cart.modifiedMethods()).containsOnlyKeys(TOTAL);
            assertThat(cart.addedMethods()).isEmpty();
            assertThat(cart.isNewType()).isFalse();
        }

        @Test
        @DisplayName("ignores edits that only move lines or touch comments")
        void layoutOnlyEdit() throws Exception {
            tree.write("shop/Cart.java", """
                    package shop;

                    // shopping cart
                    public class Cart {

                        private int items = 3;

                        /** Doubles the item count. */
                        public int total() {
                            return items * 2;
                        }
                        public float rate() { return 2.5f; }
                        public String label() { return "cart"; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, cartFile);

            assertThat(diff.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("distinguishes float constants by exact value")
        void floatConstants() throws Exception {
            tree.write("shop/Cart.java", """
                    package shop;
                    public class Cart {
                        private int items = 3;
                        public int total() { return items * 2; }
                        public float rate() { return 2.5000002f; }
                        public String label() { return "cart"; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, cartFile);

            assertThat(diff.type("shop/Cart").modifiedMethods())
                    .containsOnlyKeys(new MethodKey("shop/Cart", "rate", "()F"));
        }

        @Test
        @DisplayName("detects a changed string constant")
        void stringConstant() throws Exception {
            tree.write("shop/Cart.java", """
                    package shop;
                    public class Cart {
                        private int items = 3;
                        public int total() { return items * 2; }
                        public float rate() { return 2.5f; }
                        public String label() { return "basket"; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, cartFile);

            assertThat(diff.type("shop/Cart").modifiedMethods())
                    .containsOnlyKeys(new MethodKey("shop/Cart", "label", "()Ljava/lang/String;"));
        }

        @Test
        @DisplayName("ignores files that were not reported as changed")
        void untouchedFiles() throws Exception {
            tree.write("shop/Cart.java", """
                    package shop;
                    public class Cart {
                        private int items = 3;
                        public int total() { return 42; }
                        public float rate() { return 2.5f; }
                        public String label() { return "cart"; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, tempDir.resolve("src/shop/Other.java"));

            assertThat(diff.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("classification")
    class Classification {

        @Test
        @DisplayName("classifies methods and fields the loaded type lacks as added")
        void addedMembers() throws Exception {
            tree.write("shop/Cart.java", """
                    package shop;
                    public class Cart {
                        private int items = 3;
                        private int discount = 5;
                        public int total() { return items * 2 - discount(); }
                        public float rate() { return 2.5f; }
                        public String label() { return "cart"; }
                        int discount() { return discount; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, cartFile);

            TypeDiff cart = diff.type("shop/Cart");
            assertThat(cart.addedMethods()).containsOnlyKeys(new MethodKey("shop/Cart", "discount", "()I"));
            assertThat(cart.modifiedMethods()).containsOnlyKeys(TOTAL);
            assertThat(cart.addedFields()).containsExactly(new FieldKey("shop/Cart", "discount", "I"));
        }

        @Test
        @DisplayName("keeps a method added in an earlier cycle classified as added")
        void addedAcrossCycles() throws Exception {
            tree.write("shop/Cart.java", """
                    package shop;
                    public class Cart {
                        private int items = 3;
                        public int total() { return items * 2; }
                        public float rate() { return 2.5f; }
                        public String label() { return "cart"; }
                        int extra() { return 1; }
                    }
                    """);
            CompiledModule second = tree.compile();
            ModuleSnapshot afterFirst = ModuleSnapshot.initial(baseline).next(second);
            tree.write("shop/Cart.java", """
                    package shop;
                    public class Cart {
                        private int items = 3;
                        public int total() { return items * 2; }
                        public float rate() { return 2.5f; }
                        public String label() { return "cart"; }
                        int extra() { return 2; }
                    }
                    """);

            ModuleDiff diff = new DiffEngine(true).diff(afterFirst, baseline, tree.compile(),
                    List.of(cartFile), callGraph);

            TypeDiff cart = diff.type("shop/Cart");
            assertThat(cart.addedMethods()).containsOnlyKeys(new MethodKey("shop/Cart", "extra", "()I"));
            assertThat(cart.modifiedMethods()).isEmpty();
        }

        @Test
        @DisplayName("marks a type the live process never loaded as new")
        void newType() throws Exception {
            Path couponFile = tree.write("shop/Coupon.java", """
                    package shop;
                    public class Coupon {
                        public int value() { return 10; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, couponFile);

            assertThat(diff.newTypes()).containsExactly("shop/Coupon");
            assertThat(diff.type("shop/Coupon").addedMethods())
                    .containsKey(new MethodKey("shop/Coupon", "value", "()I"));
        }

        @Test
        @DisplayName("drops a type whose only change is its constructor")
        void constructorOnlyChange() throws Exception {
            tree.write("shop/Cart.java", """
                    package shop;
                    public class Cart {
                        private int items = 4;
                        public int total() { return items * 2; }
                        public float rate() { return 2.5f; }
                        public String label() { return "cart"; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, cartFile);

            assertThat(diff.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("generic cascade")
    class GenericCascade {

        private Path utilFile;
        private final MethodKey checkout = new MethodKey("shop/Register", "checkout", "()Ljava/lang/String;");

        @BeforeEach
        void addGenericHelper() throws Exception {
            utilFile = tree.write("shop/Util.java", """
                    package shop;
                    public class Util {
                        public static <T> T pick(T first, T second) { return first; }
                    }
                    """);
            tree.write("shop/Register.java", """
                    package shop;
                    public class Register {
                        public String checkout() { return Util.pick("a", "b"); }
                    }
                    """);
            baseline = tree.compile();
            callGraph.index(baseline);
            tree.write("shop/Util.java", """
                    package shop;
                    public class Util {
                        public static <T> T pick(T first, T second) { return second; }
                    }
                    """);
        }

        @Test
        @DisplayName("re-marks callers of a modified generic method")
        void cascadesToCallers() throws Exception {
            assertThat(callGraph.callersOf(new MethodKey("shop/Util", "pick",
                    "(Ljava/lang/Object;Ljava/lang/Object;)Ljava/lang/Object;"))).containsKey(checkout);

            ModuleDiff diff = diffAgainstBaseline(true, utilFile);

            assertThat(diff.type("shop/Util").modifiedMethods()).hasSize(1);
            assertThat(diff.type("shop/Register").modifiedMethods()).containsOnlyKeys(checkout);
        }

        @Test
        @DisplayName("re-marks callers that reach an inherited generic through a subclass")
        void cascadesThroughSubclass() throws Exception {
            tree.write("shop/Base.java", """
                    package shop;
                    public class Base {
                        public <T> T choose(T first, T second) { return first; }
                    }
                    """);
            tree.write("shop/Sub.java", """
                    package shop;
                    public class Sub extends Base {
                    }
                    """);
            tree.write("shop/Till.java", """
                    package shop;
                    public class Till {
                        public String ring() { return new Sub().choose("a", "b"); }
                    }
                    """);
            baseline = tree.compile();
            callGraph.index(baseline);
            Path baseFile = tree.write("shop/Base.java", """
                    package shop;
                    public class Base {
                        public <T> T choose(T first, T second) { return second; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, baseFile);

            assertThat(diff.type("shop/Base").modifiedMethods()).hasSize(1);
            assertThat(diff.type("shop/Till")).isNotNull();
            assertThat(diff.type("shop/Till").modifiedMethods())
                    .containsOnlyKeys(new MethodKey("shop/Till", "ring", "()Ljava/lang/String;"));
        }

        @Test
        @DisplayName("re-marks unchanged callers of a method that just became generic")
        void cascadesAfterBecomingGeneric() throws Exception {
            tree.write("shop/Coin.java", """
                    package shop;
                    public class Coin {
                        public static Object flip(Object heads, Object tails) { return heads; }
                    }
                    """);
            tree.write("shop/Toss.java", """
                    package shop;
                    public class Toss {
                        public Object call() { return Coin.flip("h", "t"); }
                    }
                    """);
            baseline = tree.compile();
            callGraph.index(baseline);
            Path coinFile = tree.write("shop/Coin.java", """
                    package shop;
                    public class Coin {
                        public static <T> T flip(T heads, T tails) { return tails; }
                    }
                    """);

            ModuleDiff diff = diffAgainstBaseline(true, coinFile);

            MethodKey flip = new MethodKey("shop/Coin", "flip",
                    "(Ljava/lang/Object;Ljava/lang/Object;)Ljava/lang/Object;");
            assertThat(callGraph.isGeneric(flip)).isTrue();
            assertThat(diff.type("shop/Toss")).isNotNull();
            assertThat(diff.type("shop/Toss").modifiedMethods())
                    .containsOnlyKeys(new MethodKey("shop/Toss", "call", "()Ljava/lang/Object;"));
        }

        @Test
        @DisplayName("leaves callers alone when cascading is off")
        void noCascade() throws Exception {
            ModuleDiff diff = diffAgainstBaseline(false, utilFile);

            assertThat(diff.type("shop/Register")).isNull();
        }
    }
}
