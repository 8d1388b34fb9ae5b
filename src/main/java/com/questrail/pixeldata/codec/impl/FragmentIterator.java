package com.questrail.pixeldata.codec.impl;

import com.questrail.pixeldata.MalformedContainerException;
import com.questrail.pixeldata.io.ByteSource;
import com.questrail.pixeldata.model.FragmentIndex;
import com.questrail.pixeldata.observability.PixelDataObservabilitySink;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * FragmentIterator
 * -----------------------------------------------------------------------------
 * Lazy, single-pass sequence of fragment values read from a {@link ByteSource}
 * positioned at a fragment's item tag.
 *
 * <p>The sequence ends at a Sequence Delimiter or at the end of the data,
 * whichever comes first, so it always terminates. Each step advances the
 * source; the iterator cannot be restarted.</p>
 *
 * <p>{@link #hasNext()} reads ahead by one item, so a malformed item surfaces
 * from {@code hasNext()} as well as from {@code next()}. Once that happens
 * the iterator is failed: every later call throws the same exception.</p>
 */
final class FragmentIterator implements Iterator<byte[]>
{
    private final ByteSource source;
    private final PixelDataObservabilitySink sink;

    private ItemCodec.Item pending;
    private boolean finished;
    private MalformedContainerException failure;

    FragmentIterator(ByteSource source, PixelDataObservabilitySink sink)
    {
        this.source = source;
        this.sink = sink;
    }

    @Override
    public boolean hasNext()
    {
        if (failure != null) {
            throw failure;
        }
        if (finished) {
            return false;
        }
        if (pending == null) {
            ItemCodec.Item item;
            try {
                item = ItemCodec.readItem(source, sink);
            }
            catch (MalformedContainerException e) {
                // the cursor is now inside the bad item
                failure = e;
                throw e;
            }
            if (!item.isValue()) {
                finished = true;
                return false;
            }
            pending = item;
        }
        return true;
    }

    @Override
    public byte[] next()
    {
        if (!hasNext()) {
            throw new NoSuchElementException("No more fragments");
        }
        byte[] value = pending.value();
        pending = null;
        return value;
    }

    /**
     * Counts the fragments that follow the current position of {@code source}
     * and records where each item tag starts. The source position is restored
     * afterwards.
     */
    static FragmentIndex index(ByteSource source, PixelDataObservabilitySink sink)
    {
        final long start = source.tell();
        final List<Long> offsets = new ArrayList<>();
        try {
            while (true) {
                ItemCodec.Item item = ItemCodec.readItem(source, sink);
                if (!item.isValue()) {
                    break;
                }
                offsets.add(item.offset());
            }
        }
        finally {
            source.seek(start);
        }
        return new FragmentIndex(offsets);
    }
}
