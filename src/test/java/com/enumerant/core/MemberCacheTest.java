package com.enumerant.core;

import com.enumerant.format.Selector;
import com.enumerant.types.IntegralType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class MemberCacheTest {

    private static RawMember<Integer> raw(String name, int value, Object... tags) {
        return new RawMember<>(name, value, List.of(tags));
    }

    private static MemberCache<Integer> cache(boolean flags, List<RawMember<Integer>> members) {
        return MemberCache.build("Test", IntegralType.INT32, flags, TagInspector.DEFAULT, members);
    }

    private static List<String> names(Iterable<Member<Integer>> members) {
        var names = new ArrayList<String>();
        members.forEach(m -> names.add(m.getName()));
        return names;
    }

    @Nested
    @DisplayName("Duplicate values")
    class Duplicates {

        @Test
        void firstDeclaredIsPrimary() {
            var cache = cache(false, List.of(raw("A", 1), raw("B", 1), raw("C", 2)));

            assertThat(cache.getByName("A", false)).map(Member::getValue).contains(1);
            assertThat(cache.getByName("B", false)).map(Member::getValue).contains(1);
            assertThat(cache.getByValue(1)).map(Member::getName).contains("A");
            assertThat(cache.count(true)).isEqualTo(3);
            assertThat(cache.count(false)).isEqualTo(2);
            assertThat(names(cache.members(true))).containsExactly("A", "B", "C");
            assertThat(names(cache.members(false))).containsExactly("A", "C");
        }

        @Test
        void primaryMarkerTakesOverTheSlot() {
            var cache = cache(false, List.of(raw("A", 1), raw("B", 1, Primary.INSTANCE), raw("C", 2)));

            assertThat(cache.getByValue(1)).map(Member::getName).contains("B");
            assertThat(cache.getAliases()).extracting(Member::getName).containsExactly("A");
            assertThat(cache.getByName("A", false)).map(Member::getValue).contains(1);
            assertThat(names(cache.members(true))).containsExactly("B", "A", "C");
        }

        @Test
        void primaryMarkerDecidesDefaultFormatting() {
            var set = ValueSet.builder("Marked", IntegralType.INT32)
                    .member("A", 1)
                    .member("B", 1, Primary.INSTANCE)
                    .build();

            assertThat(set.asString(1)).isEqualTo("B");
            assertThat(set.format(1, Selector.NAME)).isEqualTo("B");
            assertThat(set.getName(1)).contains("B");
        }

        @Test
        void aliasesMergeInValueOrder() {
            var cache = cache(false, List.of(
                    raw("Ten", 10), raw("One", 1), raw("Five", 5),
                    raw("Uno", 1), raw("Diez", 10), raw("Eins", 1)));

            assertThat(names(cache.members(true)))
                    .containsExactly("One", "Uno", "Eins", "Five", "Ten", "Diez");
            assertThat(names(cache.members(true)))
                    .as("iteration is restartable")
                    .containsExactly("One", "Uno", "Eins", "Five", "Ten", "Diez");
        }

        @Test
        void duplicateNamesRejected() {
            assertThatThrownBy(() -> cache(false, List.of(raw("A", 1), raw("A", 2))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Test.A");
        }
    }

    @Test
    void primariesAreSortedByValue() {
        var cache = cache(false, List.of(raw("C", 5), raw("A", 1), raw("B", 3), raw("Neg", -7)));

        assertThat(cache.getPrimaries()).extracting(Member::getValue).containsExactly(-7, 1, 3, 5);
        assertThat(cache.getByName("B", false)).map(Member::getValue).contains(3);
    }

    @Test
    void largeShuffledInputKeepsBothLookupsConsistent() {
        var values = new ArrayList<Integer>();
        for (int i = 0; i < 500; i++) {
            values.add(i * 3);
        }
        Collections.shuffle(values, new Random(7));
        var members = new ArrayList<RawMember<Integer>>();
        for (var value : values) {
            members.add(raw("M" + value, value));
        }

        var cache = cache(false, members);

        assertThat(cache.getPrimaries()).extracting(Member::getValue).isSorted();
        for (var value : values) {
            assertThat(cache.getByValue(value)).map(Member::getName).contains("M" + value);
            assertThat(cache.getByName("M" + value, false)).map(Member::getValue).contains(value);
        }
    }

    @Test
    void unsignedOrdering() {
        var cache = MemberCache.build("Bytes", IntegralType.UINT8, false, TagInspector.DEFAULT, List.of(
                new RawMember<>("Max", (byte) -1, List.of()),
                new RawMember<>("One", (byte) 1, List.of())));

        assertThat(cache.getPrimaries()).extracting(Member::getName).containsExactly("One", "Max");
    }

    @Nested
    @DisplayName("Contiguity")
    class ContiguityTests {

        @Test
        void contiguousRange() {
            var cache = cache(false, List.of(raw("Two", 2), raw("Zero", 0), raw("One", 1)));

            assertThat(cache.getContiguity().isContiguous()).isTrue();
            assertThat(cache.getContiguity().getMin()).isEqualTo(0);
            assertThat(cache.getContiguity().getMax()).isEqualTo(2);
            assertThat(cache.isDefined(1)).isTrue();
            assertThat(cache.isDefined(3)).isFalse();
            assertThat(cache.isDefined(-1)).isFalse();
        }

        @Test
        void gapsAreNotContiguous() {
            var cache = cache(false, List.of(raw("One", 1), raw("Three", 3), raw("Five", 5)));

            assertThat(cache.getContiguity().isContiguous()).isFalse();
            assertThat(cache.isDefined(3)).isTrue();
            assertThat(cache.isDefined(2)).isFalse();
        }

        @Test
        void aliasesDoNotCountTowardsContiguity() {
            var cache = cache(false, List.of(raw("A", 0), raw("B", 1), raw("C", 1)));

            assertThat(cache.getContiguity().isContiguous()).isTrue();
        }

        @Test
        void fullSignedRangeOfAByteIsContiguous() {
            var members = new ArrayList<RawMember<Byte>>();
            for (int i = -128; i <= 127; i++) {
                members.add(new RawMember<>("V" + (i + 128), (byte) i, List.of()));
            }
            var cache = MemberCache.build("AllBytes", IntegralType.INT8, false, TagInspector.DEFAULT, members);

            assertThat(cache.getContiguity().isContiguous()).isTrue();
            assertThat(cache.getContiguity().getMin()).isEqualTo((byte) -128);
        }

        @Test
        void emptyCacheIsValid() {
            var cache = cache(false, List.of());

            assertThat(cache.count(true)).isZero();
            assertThat(cache.getContiguity().isContiguous()).isFalse();
            assertThat(cache.getContiguity().getMin()).isNull();
            assertThat(cache.getByValue(0)).isEmpty();
            assertThat(cache.isDefined(0)).isFalse();
            assertThat(cache.members(true)).isEmpty();
        }
    }

    @Test
    void flagUnionOnlyCountsSingleBitValues() {
        var cache = cache(true, List.of(raw("None", 0), raw("Read", 1), raw("Write", 2), raw("ReadWrite", 3), raw("Exec", 8)));

        assertThat(cache.getFlagUnion()).isEqualTo(11);
        assertThat(cache(false, List.of(raw("Read", 1))).getFlagUnion()).isEqualTo(0);
    }

    @Test
    void descriptionTagIsHoisted() {
        var cache = cache(false, List.of(raw("A", 1, "marker", new Description("first letter"))));
        var member = cache.getByValue(1).orElseThrow();

        assertThat(member.getTags()).hasSize(2);
        assertThat(member.getTags().get(0)).isEqualTo(new Description("first letter"));
        assertThat(member.getDescription()).isEqualTo("first letter");
        assertThat(member.getTag(String.class)).isEqualTo("marker");
        assertThat(member.hasTag(Primary.class)).isFalse();
    }

    @Test
    void ignoreCaseLookupIsOptIn() {
        var cache = cache(false, List.of(raw("Read", 1), raw("Reading", 1), raw("READ", 2)));

        assertThat(cache.getByName("read", false)).isEmpty();
        assertThat(cache.getByName("read", true)).map(Member::getName).contains("Read");
        assertThat(cache.getByName("READ", true)).map(Member::getName).contains("READ");
        assertThat(cache.getByName("reading", true)).map(Member::getValue).contains(1);
    }

    @Test
    void ignoreCaseLookupFoldsSupplementaryCharacters() {
        var upper = "X" + new String(Character.toChars(0x10400));
        var lower = "X" + new String(Character.toChars(0x10428));
        var cache = cache(false, List.of(raw(upper, 1)));

        assertThat(upper.equalsIgnoreCase(lower)).isTrue();
        assertThat(cache.getByName(lower, false)).isEmpty();
        assertThat(cache.getByName(lower, true)).map(Member::getValue).contains(1);
    }

    @Test
    void nullTagRejectedAfterDescription() {
        var tags = Arrays.<Object>asList(new Description("first"), null);

        assertThatThrownBy(() -> cache(false, List.of(new RawMember<>("A", 1, tags))))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("A");
    }

    @Test
    void memberValueTagIsRecorded() {
        var cache = cache(false, List.of(raw("A", 1, new MemberValue("a"), new Description("first")), raw("B", 2)));

        var a = cache.getByValue(1).orElseThrow();
        assertThat(a.getMemberValue()).isEqualTo("a");
        assertThat(a.getDescription()).isEqualTo("first");
        assertThat(cache.getByValue(2).orElseThrow().getMemberValue()).isNull();
    }

    @Test
    void nullInputRejectedEagerly() {
        assertThatThrownBy(() -> cache(false, List.of(new RawMember<>(null, 1, List.of()))))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> cache(false, List.of(new RawMember<>("A", null, List.of()))))
                .isInstanceOf(NullPointerException.class);
    }
}
