package org.csu.pagebuf.storage.page;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

public class PageTest {

    @Test
    void testNewPageIsZeroedAndInvalid() {
        Page page = new Page();
        assertFalse(page.getPageId().isValid());
        assertEquals(Page.PAGE_SIZE, page.getData().capacity());
        assertArrayEquals(new byte[Page.PAGE_SIZE], page.copyOfData());
    }

    @Test
    void testCopyFromKeepsOwnBuffer() {
        Page source = new Page(new PageId(7));
        source.getData().putLong(16, 42L);
        Page frame = new Page();
        ByteBuffer bufferBefore = frame.getData();

        frame.copyFrom(source);

        assertSame(bufferBefore, frame.getData());
        assertEquals(7, frame.getPageNum());
        assertEquals(42L, frame.getData().getLong(16));

        // 两页互不影响
        source.getData().putLong(16, 0L);
        assertEquals(42L, frame.getData().getLong(16));
    }

    @Test
    void testResetClearsContent() {
        Page page = new Page(new PageId(3));
        page.getData().putInt(0, 99);
        page.reset();
        assertEquals(PageId.INVALID_PAGE_NUM, page.getPageNum());
        assertEquals(0, page.getData().getInt(0));
    }

    @Test
    void testRawDataMustBePageSized() {
        assertThrows(IllegalArgumentException.class, () -> new Page(new PageId(0), new byte[10]));
    }
}
