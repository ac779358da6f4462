package hotreload.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AddedFields")
class AddedFieldsTest {

    static final class Account {
    }

    @AfterEach
    void tearDown() {
        AddedFields.clearAll();
    }

    @Nested
    @DisplayName("instance fields")
    class InstanceFields {

        @Test
        @DisplayName("start with the zero value of their descriptor")
        void zeroValue() {
            Account account = new Account();

            assertThat(AddedFields.slot(account, Account.class, "count", "I").get()).isEqualTo(0);
            assertThat(AddedFields.slot(account, Account.class, "flag", "Z").get()).isEqualTo(false);
            assertThat(AddedFields.slot(account, Account.class, "name", "Ljava/lang/String;").get()).isNull();
        }

        @Test
        @DisplayName("start with a registered initializer")
        void initializer() {
            AddedFields.registerInitializer(5, Account.class, "limit", "I");
            Account account = new Account();

            assertThat(AddedFields.slot(account, Account.class, "limit", "I").get()).isEqualTo(5);
        }

        @Test
        @DisplayName("keep a value stored through any path")
        void storeAndRead() {
            Account account = new Account();
            FieldSlot address = AddedFields.slot(account, Account.class, "limit", "I");

            AddedFields.store(account, 7, Account.class, "limit", "I");

            assertThat(address.get()).isEqualTo(7);
            assertThat(AddedFields.slot(account, Account.class, "limit", "I")).isSameAs(address);
        }

        @Test
        @DisplayName("are separate per instance")
        void perInstance() {
            Account a = new Account();
            Account b = new Account();

            AddedFields.store(a, 1, Account.class, "limit", "I");

            assertThat(AddedFields.slot(b, Account.class, "limit", "I").get()).isEqualTo(0);
            assertThat(AddedFields.fieldNames(a)).containsExactly(Account.class.getName() + ".limit");
            assertThat(AddedFields.hasAddedFields(b)).isTrue();
        }

        @Test
        @DisplayName("reset when the field changes type")
        void typeChange() {
            Account account = new Account();
            AddedFields.store(account, 9, Account.class, "limit", "I");

            FieldSlot widened = AddedFields.slot(account, Account.class, "limit", "J");

            assertThat(widened.get()).isEqualTo(0L);
        }

        @Test
        @DisplayName("reject access through a null instance")
        void nullInstance() {
            assertThatThrownBy(() -> AddedFields.slot(null, Account.class, "limit", "I"))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("limit");
        }

        @Test
        @DisplayName("are created exactly once under concurrent first access")
        void exactlyOnce() throws Exception {
            Account account = new Account();
            int threads = 16;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<FieldSlot>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return AddedFields.slot(account, Account.class, "hits", "I");
                    }));
                }
                start.countDown();

                Set<FieldSlot> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
                for (Future<FieldSlot> f : futures) {
                    distinct.add(f.get(5, TimeUnit.SECONDS));
                }
                assertThat(distinct).hasSize(1);
                assertThat(AddedFields.statistics().instanceSlots()).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("static fields")
    class StaticFields {

        @Test
        @DisplayName("are shared per owner")
        void shared() {
            AddedFields.storeStatic("eu", Account.class, "region", "Ljava/lang/String;");

            assertThat(AddedFields.staticSlot(Account.class, "region", "Ljava/lang/String;").get())
                    .isEqualTo("eu");
            assertThat(AddedFields.statistics().staticSlots()).isEqualTo(1);
        }

        @Test
        @DisplayName("ignore an initializer of the wrong kind")
        void mismatchedInitializer() {
            AddedFields.registerInitializer("five", Account.class, "max", "I");

            assertThat(AddedFields.staticSlot(Account.class, "max", "I").get()).isEqualTo(0);
        }
    }

    @Test
    @DisplayName("clear drops the slots of one instance")
    void clearInstance() {
        Account account = new Account();
        AddedFields.store(account, 3, Account.class, "limit", "I");

        AddedFields.clear(account);

        assertThat(AddedFields.hasAddedFields(account)).isFalse();
        assertThat(AddedFields.slot(account, Account.class, "limit", "I").get()).isEqualTo(0);
    }
}
