// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.Iterator;
import java.util.List;

import sh.scalekit.core.codec.Codec;

/**
 * A codec holding an ordered list of element values. Sequence codecs convert into
 * each other element by element.
 */
public interface Sequence extends Codec, Iterable<Codec> {

    /**
     * Returns the read-only element list.
     */
    List<Codec> elements();

    default Codec get(final int index) {
        return elements().get(index);
    }

    default int size() {
        return elements().size();
    }

    @Override
    default Iterator<Codec> iterator() {
        return elements().iterator();
    }
}
