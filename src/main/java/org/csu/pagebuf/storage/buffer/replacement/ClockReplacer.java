package org.csu.pagebuf.storage.buffer.replacement;

import lombok.Getter;
import org.csu.pagebuf.common.exception.BufferExceededException;
import org.csu.pagebuf.storage.buffer.FrameDescriptor;

/**
 * Clock (时钟) 页面替换策略，也称为“二次机会”算法。
 * 时钟指针在帧数组上循环移动，被引用过的帧先清掉引用位放过一次，
 * 第二次转到时若仍未被引用且没有被 pin 才会被选中。
 */
public class ClockReplacer implements BufferPoolReplacer {

    private final int numBufs;
    private final boolean verbose;

    // 指针初始指向最后一帧，这样第一次扫描从 0 号帧开始
    @Getter
    private int clockHand;

    public ClockReplacer(int numBufs, boolean verbose) {
        if (numBufs <= 0) {
            throw new IllegalArgumentException("numBufs must be positive: " + numBufs);
        }
        this.numBufs = numBufs;
        this.verbose = verbose;
        this.clockHand = numBufs - 1;
    }

    private void advanceClock() {
        clockHand = (clockHand + 1) % numBufs;
    }

    /**
     * 从本次调用开始时的指针位置起扫描。转满一圈而且这一圈里
     * 没有清掉任何引用位时才判定缓冲池已满；清过引用位的话再转一圈。
     */
    @Override
    public int pickVictim(FrameDescriptor[] frames) {
        final int start = clockHand;
        boolean progress = false;

        if (verbose) {
            System.out.printf("[Clock] Need a free frame. Starting scan after frame %d...%n", start);
        }
        while (true) {
            advanceClock();
            FrameDescriptor desc = frames[clockHand];

            if (!desc.isValid()) {
                if (verbose) {
                    System.out.printf("[Clock]  -> Frame %d is empty, using it.%n", clockHand);
                }
                return clockHand;
            }
            if (desc.isReferenced()) {
                desc.clearReferenced();
                progress = true;
                if (verbose) {
                    System.out.printf("[Clock]  -> Giving frame %d (page %s) a second chance. Ref bit cleared.%n",
                            clockHand, desc.getPageId());
                }
            } else if (desc.getPinCount() == 0) {
                if (verbose) {
                    System.out.printf("[Clock]  -> Found victim! Frame %d (page %s) has ref bit 0 and no pins.%n",
                            clockHand, desc.getPageId());
                }
                return clockHand;
            }

            if (clockHand == start) {
                if (!progress) {
                    if (verbose) {
                        System.out.printf("[Clock]  -> Full revolution without progress, all %d frames pinned.%n", numBufs);
                    }
                    throw new BufferExceededException(numBufs);
                }
                progress = false;
            }
        }
    }
}
