package org.csu.pagebuf.common.exception;

import lombok.Getter;

/**
 * unpin 的页当前不在缓冲池中。
 */
@Getter
public class PageNotFoundException extends BufferPoolException {
    private final String fileName;
    private final int pageNum;

    public PageNotFoundException(String fileName, int pageNum) {
        super(String.format("Page %d of file '%s' is not resident in the buffer pool", pageNum, fileName));
        this.fileName = fileName;
        this.pageNum = pageNum;
    }
}
