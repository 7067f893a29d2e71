package org.csu.pagebuf.storage.buffer;

import lombok.Getter;
import org.csu.pagebuf.common.exception.InvalidFrameException;
import org.csu.pagebuf.common.exception.PageNotFoundException;
import org.csu.pagebuf.common.exception.PageNotPinnedException;
import org.csu.pagebuf.common.exception.PagePinnedException;
import org.csu.pagebuf.storage.buffer.index.BufferHashTable;
import org.csu.pagebuf.storage.buffer.index.SlotIndex;
import org.csu.pagebuf.storage.buffer.replacement.BufferPoolReplacer;
import org.csu.pagebuf.storage.buffer.replacement.ClockReplacer;
import org.csu.pagebuf.storage.disk.PagedFile;
import org.csu.pagebuf.storage.page.Page;
import org.csu.pagebuf.storage.page.PageId;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * 缓存池管理器，负责管理内存中的页缓存。
 * <p>
 * 缓冲池是固定数量的帧，描述符表与之平行，下标就是帧号；
 * 槽位索引把 (file, page) 映射到帧号。调用方通过 fetch/alloc 拿到的页
 * 都已被 pin 住，用完必须恰好 unpin 一次，pin 计数不为 0 的帧不会被淘汰。
 * <p>
 * 所有公开操作都在本对象上同步，选牺牲帧、改索引、改描述符是一个原子步骤。
 */
public class BufferPoolManager implements AutoCloseable {
    @Getter
    private final int numBufs;
    private final FrameDescriptor[] bufDescTable;
    private final Page[] bufPool;
    private final SlotIndex slotIndex;
    private final BufferPoolReplacer replacer;
    private final boolean verbose;

    @Getter
    private int hitCount = 0;
    @Getter
    private int missCount = 0;

    public BufferPoolManager(int numBufs) {
        this(BufferPoolConfig.builder().numBufs(numBufs).build());
    }

    public BufferPoolManager(BufferPoolConfig config) {
        this(config, new BufferHashTable(BufferHashTable.sizeFor(config.getNumBufs(), config.getHashTableScale())));
    }

    public BufferPoolManager(BufferPoolConfig config, SlotIndex slotIndex) {
        config.validate();
        this.numBufs = config.getNumBufs();
        this.verbose = config.isVerbose();
        this.slotIndex = slotIndex;
        this.replacer = new ClockReplacer(numBufs, verbose);

        this.bufDescTable = new FrameDescriptor[numBufs];
        this.bufPool = new Page[numBufs];
        for (int i = 0; i < numBufs; i++) {
            bufDescTable[i] = new FrameDescriptor(i);
            bufPool[i] = new Page();
        }
    }

    /**
     * 取一页并 pin 住。命中时不做任何 I/O；未命中时先找一个空闲帧
     * （可能淘汰并写回一个脏页），再从文件读入。
     *
     * @throws org.csu.pagebuf.common.exception.BufferExceededException 所有帧都被 pin 住
     */
    public synchronized Page fetchPage(PagedFile file, PageId pageId) throws IOException {
        if (file == null || pageId == null) {
            throw new IllegalArgumentException("File and PageId cannot be null.");
        }

        OptionalInt hit = slotIndex.lookup(file, pageId);
        if (hit.isPresent()) {
            hitCount++;
            int frameNo = hit.getAsInt();
            bufDescTable[frameNo].pin();
            return bufPool[frameNo];
        }
        missCount++;

        int frameNo = allocBuf();
        Page onDisk = file.readPage(pageId);
        bufPool[frameNo].copyFrom(onDisk);
        slotIndex.insert(file, pageId, frameNo);
        bufDescTable[frameNo].set(file, pageId);
        return bufPool[frameNo];
    }

    /**
     * 释放一次 pin。dirty 为 true 时把页标记为脏，脏标记只会被写回清掉。
     *
     * @throws PageNotFoundException  页不在缓冲池中
     * @throws PageNotPinnedException pin 计数已经是 0
     */
    public synchronized void unpinPage(PagedFile file, PageId pageId, boolean dirty) {
        OptionalInt hit = slotIndex.lookup(file, pageId);
        if (hit.isEmpty()) {
            throw new PageNotFoundException(file.getFileName(), pageId.getPageNum());
        }
        FrameDescriptor desc = bufDescTable[hit.getAsInt()];
        if (desc.getPinCount() == 0) {
            throw new PageNotPinnedException(file.getFileName(), pageId.getPageNum(), desc.getFrameNo());
        }
        desc.unpin();
        if (dirty) {
            desc.markDirty();
        }
    }

    /**
     * 在文件中分配一个新页并装入缓冲池，返回的页已被 pin 住，页号见 {@link Page#getPageId()}。
     * 先找帧再让文件分配页，缓冲池满时文件里不会多出一个无人引用的页。
     */
    public synchronized Page allocPage(PagedFile file) throws IOException {
        int frameNo = allocBuf();
        Page newPage = file.allocatePage();
        bufPool[frameNo].copyFrom(newPage);
        PageId pageId = newPage.getPageId();
        slotIndex.insert(file, pageId, frameNo);
        bufDescTable[frameNo].set(file, pageId);
        if (verbose) {
            System.out.printf("[BufferPool] Allocated page %s of '%s' into frame %d.%n", pageId, file.getFileName(), frameNo);
        }
        return bufPool[frameNo];
    }

    /**
     * 从文件中删除一页；若它在缓冲池中，一并丢弃（不写回）。
     *
     * @throws PagePinnedException 页仍被 pin 住
     */
    public synchronized void disposePage(PagedFile file, PageId pageId) throws IOException {
        OptionalInt hit = slotIndex.lookup(file, pageId);
        if (hit.isPresent()) {
            int frameNo = hit.getAsInt();
            FrameDescriptor desc = bufDescTable[frameNo];
            if (desc.getPinCount() > 0) {
                throw new PagePinnedException(file.getFileName(), pageId.getPageNum(), frameNo);
            }
            slotIndex.remove(file, pageId);
            desc.clear();
            bufPool[frameNo].reset();
        }
        file.deletePage(pageId);
        if (verbose) {
            System.out.printf("[BufferPool] Disposed page %s of '%s'.%n", pageId, file.getFileName());
        }
    }

    /**
     * 把属于该文件的所有帧写回（仅脏页）并移出缓冲池。
     * 先检查再动手：只要有一帧被 pin 住或状态不一致，就什么都不改。
     *
     * @throws PagePinnedException   该文件有页仍被 pin 住
     * @throws InvalidFrameException 某帧属于该文件却无效
     */
    public synchronized void flushFile(PagedFile file) throws IOException {
        List<FrameDescriptor> owned = new ArrayList<>();
        for (FrameDescriptor desc : bufDescTable) {
            if (!desc.belongsTo(file)) {
                continue;
            }
            if (desc.getPinCount() != 0) {
                throw new PagePinnedException(file.getFileName(), desc.getPageId().getPageNum(), desc.getFrameNo());
            }
            if (!desc.isValid()) {
                throw new InvalidFrameException(desc.getFrameNo(), desc.isDirty(), desc.isValid(), desc.isReferenced());
            }
            owned.add(desc);
        }

        int written = 0;
        for (FrameDescriptor desc : owned) {
            int frameNo = desc.getFrameNo();
            if (desc.isDirty()) {
                file.writePage(bufPool[frameNo]);
                desc.markClean();
                written++;
            }
            slotIndex.remove(file, desc.getPageId());
            desc.clear();
            bufPool[frameNo].reset();
        }
        if (verbose) {
            System.out.printf("[BufferPool] Flushed '%s': %d frame(s) released, %d written back.%n",
                    file.getFileName(), owned.size(), written);
        }
    }

    /**
     * 关闭缓冲池：凡是还有脏帧的文件都 flush 一遍。文件对象此时必须仍然可用。
     */
    @Override
    public synchronized void close() throws IOException {
        for (FrameDescriptor desc : bufDescTable) {
            if (desc.isValid() && desc.isDirty()) {
                flushFile(desc.getFile());
            }
        }
    }

    /**
     * 取得一个可用帧，返回时该帧的描述符已清空。被选中的有效帧若是脏的，先写回再复用。
     */
    private int allocBuf() throws IOException {
        int frameNo = replacer.pickVictim(bufDescTable);
        FrameDescriptor desc = bufDescTable[frameNo];
        if (desc.isValid()) {
            PagedFile owner = desc.getFile();
            PageId victim = desc.getPageId();
            if (desc.isDirty()) {
                owner.writePage(bufPool[frameNo]);
                if (verbose) {
                    System.out.printf("[BufferPool] Wrote back dirty page %s of '%s' from frame %d.%n",
                            victim, owner.getFileName(), frameNo);
                }
            }
            slotIndex.remove(owner, victim);
            if (verbose) {
                System.out.printf("[BufferPool] Evicted page %s of '%s' from frame %d.%n",
                        victim, owner.getFileName(), frameNo);
            }
        }
        desc.clear();
        return frameNo;
    }

    // --- 统计与诊断 ---

    public synchronized boolean isResident(PagedFile file, PageId pageId) {
        return slotIndex.lookup(file, pageId).isPresent();
    }

    public synchronized int getValidFrameCount() {
        int count = 0;
        for (FrameDescriptor desc : bufDescTable) {
            if (desc.isValid()) {
                count++;
            }
        }
        return count;
    }

    /**
     * 某帧描述符的快照，修改它不会影响缓冲池。
     */
    public synchronized FrameDescriptor getFrameDescriptor(int frameNo) {
        return bufDescTable[frameNo].snapshot();
    }

    public synchronized double getHitRate() {
        int total = hitCount + missCount;
        if (total == 0) {
            return 0.0;
        }
        return (double) hitCount / total;
    }

    public synchronized void resetStats() {
        hitCount = 0;
        missCount = 0;
    }

    public void printSelf() {
        printSelf(System.out);
    }

    public synchronized void printSelf(PrintStream out) {
        int validFrames = 0;
        for (int i = 0; i < numBufs; i++) {
            FrameDescriptor desc = bufDescTable[i];
            out.println("FrameNo:" + i + " " + desc);
            if (desc.isValid()) {
                validFrames++;
            }
        }
        out.println("Total Number of Valid Frames:" + validFrames);
    }
}
