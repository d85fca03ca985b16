package absstr.memory;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * A memory image made of loaded segments.
 */
public final class SegmentedMemoryImage implements RuntimeMemoryImage {
	private final ImmutableList<MemorySegment> segments;
	private final boolean bigEndian;

	public SegmentedMemoryImage(List<MemorySegment> segments, boolean bigEndian) {
		this.segments = ImmutableList.copyOf(segments);
		this.bigEndian = bigEndian;
	}

	/**
	 * @return A little-endian image.
	 */
	public static SegmentedMemoryImage of(MemorySegment... segments) {
		return new SegmentedMemoryImage(List.of(segments), false);
	}

	public ImmutableList<MemorySegment> getSegments() {
		return this.segments;
	}

	private Optional<MemorySegment> findSegment(long address) {
		return this.segments.stream()
			.filter(seg -> seg.contains(address))
			.findFirst();
	}

	@Override
	public Optional<byte[]> read(long address, int size) {
		return findSegment(address)
			.filter(seg -> seg.contains(address, size))
			.map(seg -> seg.read(address, size));
	}

	@Override
	public boolean isGlobalMemoryAddress(long address) {
		return findSegment(address).isPresent();
	}

	@Override
	public boolean isAddressWriteable(long address) {
		return findSegment(address)
			.map(MemorySegment::isWriteable)
			.orElse(false);
	}

	@Override
	public boolean isBigEndian() {
		return this.bigEndian;
	}
}
