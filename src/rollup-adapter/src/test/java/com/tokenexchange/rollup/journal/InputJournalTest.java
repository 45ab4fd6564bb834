package com.tokenexchange.rollup.journal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputJournalTest {

    @TempDir
    Path dir;

    @Test
    void shouldReplayPayloadsInAppendOrder() throws Exception {
        InputJournal journal = new InputJournal(dir.toString(), 1);
        byte[] first = {1, 2, 3};
        byte[] second = {};
        byte[] third = new byte[1000];
        third[999] = 7;

        assertTrue(journal.append(first));
        assertTrue(journal.append(second));
        assertTrue(journal.append(third));

        List<byte[]> replayed = journal.replay();
        assertEquals(3, replayed.size());
        assertArrayEquals(first, replayed.get(0));
        assertArrayEquals(second, replayed.get(1));
        assertArrayEquals(third, replayed.get(2));
        assertEquals(3, journal.getRecordCount());
        journal.close();

        assertTrue(Files.exists(dir.resolve(InputJournal.FILE_NAME)));
    }

    @Test
    void shouldResumeAfterExistingRecordsOnReopen() throws Exception {
        InputJournal journal = new InputJournal(dir.toString(), 1);
        journal.append(new byte[] {10});
        journal.append(new byte[] {20, 21});
        int position = journal.getPosition();
        journal.close();

        InputJournal reopened = new InputJournal(dir.toString(), 1);
        assertEquals(2, reopened.getRecordCount());
        assertEquals(position, reopened.getPosition());

        reopened.append(new byte[] {30});
        List<byte[]> replayed = reopened.replay();
        assertEquals(3, replayed.size());
        assertArrayEquals(new byte[] {20, 21}, replayed.get(1));
        assertArrayEquals(new byte[] {30}, replayed.get(2));
        reopened.close();
    }

    @Test
    void shouldRefuseAppendsOnceFull() throws Exception {
        InputJournal journal = new InputJournal(dir.toString(), 1);
        byte[] big = new byte[journal.getCapacity() / 2];

        assertTrue(journal.append(big));
        assertFalse(journal.append(big));
        assertTrue(journal.isFull());
        assertFalse(journal.append(new byte[] {1}));
        assertEquals(1, journal.replay().size());
        journal.close();
    }
}
