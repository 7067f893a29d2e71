package org.csu.pagebuf.common.exception;

import lombok.Getter;

/**
 * 访问了从未分配或已经删除的页。由文件层抛出，缓冲池原样向上传递。
 */
@Getter
public class InvalidPageException extends RuntimeException {
    private final String fileName;
    private final int pageNum;

    public InvalidPageException(String fileName, int pageNum) {
        super(String.format("Page %d does not exist in file '%s'", pageNum, fileName));
        this.fileName = fileName;
        this.pageNum = pageNum;
    }
}
