package org.csu.pagebuf.storage.disk;

import org.csu.pagebuf.storage.page.Page;
import org.csu.pagebuf.storage.page.PageId;

import java.io.IOException;

/**
 * 缓冲池所依赖的分页文件。缓冲池用对象本身（引用相等）区分不同的文件。
 */
public interface PagedFile {

    /**
     * 读取一页。
     * @throws org.csu.pagebuf.common.exception.InvalidPageException 页不存在
     */
    Page readPage(PageId pageId) throws IOException;

    /**
     * 持久化一页，写到 {@code page.getPageId()} 对应的位置。
     */
    void writePage(Page page) throws IOException;

    /**
     * 分配一个新页并返回其初始内容，页号由文件决定。
     */
    Page allocatePage() throws IOException;

    /**
     * 永久删除一页。
     */
    void deletePage(PageId pageId) throws IOException;

    /**
     * 用于诊断输出的文件名。
     */
    String getFileName();
}
