package com.commandhub;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChatSessionMemoryTest {

    @Test
    void remembersLastProjectPerSession() {
        ChatSessionMemory memory = new ChatSessionMemory();

        memory.remember("s1", "42");
        memory.remember("s1", "43");
        memory.remember("s2", "7");
        memory.remember("s3", " ");

        assertEquals(Optional.of("43"), memory.lastProject("s1"));
        assertEquals(Optional.of("7"), memory.lastProject("s2"));
        assertEquals(Optional.empty(), memory.lastProject("s3"));
        assertEquals(Optional.empty(), memory.lastProject(null));
        assertEquals(2, memory.size());
    }

    @Test
    void capacityHoldsUnderManyFreshSessions() {
        ChatSessionMemory memory = new ChatSessionMemory(100);

        for (int i = 0; i < 5_000; i++) {
            memory.remember("chat_" + i, "p" + i);
        }

        assertEquals(100, memory.size());
        assertEquals(Optional.of("p4999"), memory.lastProject("chat_4999"));
        assertEquals(Optional.empty(), memory.lastProject("chat_0"));
    }

    @Test
    void recentlyReadSessionSurvivesEviction() {
        ChatSessionMemory memory = new ChatSessionMemory(2);
        memory.remember("old", "1");
        memory.remember("mid", "2");

        memory.lastProject("old");
        memory.remember("new", "3");

        assertEquals(Optional.of("1"), memory.lastProject("old"));
        assertEquals(Optional.empty(), memory.lastProject("mid"));
        assertEquals(Optional.of("3"), memory.lastProject("new"));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ChatSessionMemory(0));
    }
}
