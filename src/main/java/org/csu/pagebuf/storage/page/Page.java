package org.csu.pagebuf.storage.page;

import lombok.Getter;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 定长页。内容对缓冲池来说是不透明的字节，页号随内容一起携带，
 * 写回时由文件根据 {@link #getPageId()} 决定写到哪里。
 */
@Getter
public class Page {
    public static final int PAGE_SIZE = 4096; // 4KB

    private PageId pageId;
    private final ByteBuffer data;

    /**
     * 空页，页号无效。缓冲池用它占住每个帧的存储。
     */
    public Page() {
        this(new PageId(PageId.INVALID_PAGE_NUM));
    }

    public Page(PageId pageId) {
        this.pageId = pageId;
        this.data = ByteBuffer.allocate(PAGE_SIZE);
    }

    public Page(PageId pageId, byte[] rawData) {
        if (rawData.length != PAGE_SIZE) {
            throw new IllegalArgumentException("Page data must be exactly " + PAGE_SIZE + " bytes, got " + rawData.length);
        }
        this.pageId = pageId;
        this.data = ByteBuffer.wrap(rawData);
    }

    public int getPageNum() {
        return pageId.getPageNum();
    }

    /**
     * 把另一页的页号和全部内容复制到本页，本页的 ByteBuffer 实例保持不变。
     */
    public void copyFrom(Page other) {
        this.pageId = other.pageId;
        System.arraycopy(other.data.array(), 0, this.data.array(), 0, PAGE_SIZE);
        this.data.clear();
    }

    /**
     * 返回内容的一份拷贝，调用方修改它不会影响本页。
     */
    public byte[] copyOfData() {
        byte[] bytes = new byte[PAGE_SIZE];
        System.arraycopy(data.array(), 0, bytes, 0, PAGE_SIZE);
        return bytes;
    }

    /**
     * 清空内容并把页号置为无效。
     */
    public void reset() {
        this.pageId = new PageId(PageId.INVALID_PAGE_NUM);
        Arrays.fill(data.array(), (byte) 0);
        this.data.clear();
    }
}
