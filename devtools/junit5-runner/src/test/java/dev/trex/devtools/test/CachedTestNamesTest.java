package dev.trex.devtools.test;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.platform.engine.TestDescriptor;
import org.junit.platform.engine.TestSource;
import org.junit.platform.engine.UniqueId;
import org.junit.platform.engine.support.descriptor.AbstractTestDescriptor;
import org.junit.platform.engine.support.descriptor.ClassSource;
import org.junit.platform.engine.support.descriptor.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CachedTestNamesTest {

    @Test
    void fileIsTheTopLevelClassFile() {
        assertEquals("org/example/CalcTest.class", CachedTestNames.fileOfClass("org.example.CalcTest"));
        assertEquals("org/example/CalcTest.class", CachedTestNames.fileOfClass("org.example.CalcTest$Inner"));
        assertEquals("CalcTest.class", CachedTestNames.fileOfClass("CalcTest"));
    }

    @Test
    void nestedClassesPrefixTheMethodName() {
        assertEquals("adds", CachedTestNames.testNameOf("org.example.CalcTest", "adds"));
        assertEquals("Inner::adds", CachedTestNames.testNameOf("org.example.CalcTest$Inner", "adds"));
        assertEquals("Inner::Deeper::adds", CachedTestNames.testNameOf("org.example.CalcTest$Inner$Deeper", "adds"));
    }

    @Test
    void methodsAreItemsWithCompositeIds() {
        TestDescriptorNames names = new TestDescriptorNames();
        TestDescriptor method = descriptor("adds", MethodSource.from("org.example.CalcTest$Inner", "adds"));

        assertTrue(names.isItem(method));
        assertEquals(Optional.of("org/example/CalcTest.class"), names.getFile(method));
        assertEquals(Optional.of("Inner::adds"), names.getTestName(method));
        assertEquals(Optional.of("org/example/CalcTest.class::Inner::adds"), names.getCompositeId(method));
    }

    @Test
    void classesHaveAFileButNoId() {
        TestDescriptorNames names = new TestDescriptorNames();
        TestDescriptor container = descriptor("CalcTest", ClassSource.from("org.example.CalcTest"));

        assertFalse(names.isItem(container));
        assertEquals(Optional.of("org/example/CalcTest.class"), names.getFile(container));
        assertEquals(Optional.empty(), names.getCompositeId(container));
    }

    @Test
    void descriptorsWithoutSourceHaveNoNames() {
        TestDescriptorNames names = new TestDescriptorNames();
        TestDescriptor engine = descriptor("engine", null);

        assertFalse(names.isItem(engine));
        assertEquals(Optional.empty(), names.getFile(engine));
        assertEquals(Optional.empty(), names.getTestName(engine));
    }

    static TestDescriptor descriptor(String name, TestSource source) {
        UniqueId id = UniqueId.forEngine("sample").append("item", name);
        return new AbstractTestDescriptor(id, name, source) {
            @Override
            public Type getType() {
                return source instanceof MethodSource ? Type.TEST : Type.CONTAINER;
            }
        };
    }
}
