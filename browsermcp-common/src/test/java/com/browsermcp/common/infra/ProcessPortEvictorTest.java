package com.browsermcp.common.infra;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessPortEvictorTest {

    @Test
    void parseLsofPids_readsPidFieldsOnce() {
        String output = "p1234\ncjava\nn127.0.0.1:9009\np5678\ncnode\np1234\n";
        assertEquals(List.of(1234L, 5678L), ProcessPortEvictor.parseLsofPids(output));
    }

    @Test
    void parseLsofPids_emptyOrNull() {
        assertTrue(ProcessPortEvictor.parseLsofPids("").isEmpty());
        assertTrue(ProcessPortEvictor.parseLsofPids(null).isEmpty());
    }

    @Test
    void parseNetstatOutput_matchesListeningPortOnly() {
        String output = String.join("\n",
                "  Proto  Local Address          Foreign Address        State           PID",
                "  TCP    0.0.0.0:9009           0.0.0.0:0              LISTENING       4321",
                "  TCP    0.0.0.0:19009          0.0.0.0:0              LISTENING       9999",
                "  TCP    127.0.0.1:9009         127.0.0.1:50000        ESTABLISHED     4321");

        assertEquals(List.of(4321L), ProcessPortEvictor.parseNetstatOutput(output, 9009));
    }

    @Test
    void otherPids_neverIncludesOwnPid() {
        ProcessPortEvictor evictor = new ProcessPortEvictor(10, 42L);
        assertEquals(List.of(7L, 8L), evictor.otherPids(List.of(7L, 42L, 8L)));
        assertTrue(evictor.otherPids(List.of(42L)).isEmpty());
    }
}
