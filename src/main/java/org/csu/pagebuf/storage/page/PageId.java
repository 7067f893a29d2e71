package org.csu.pagebuf.storage.page;

/**
 * 页号，在单个文件内唯一标识一个页。
 */
public class PageId {
    public static final int INVALID_PAGE_NUM = -1;

    private final int pageNum;

    public PageId(int pageNum) {
        this.pageNum = pageNum;
    }

    public int getPageNum() {
        return pageNum;
    }

    public boolean isValid() {
        return pageNum != INVALID_PAGE_NUM;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PageId pageId = (PageId) o;
        return pageNum == pageId.pageNum;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(pageNum);
    }

    @Override
    public String toString() {
        return String.valueOf(pageNum);
    }
}
