package absstr.memory;

import static com.google.common.truth.Truth.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.OptionalLong;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link SegmentedMemoryImage}.
 */
@RunWith(JUnit4.class)
public class SegmentedMemoryImageTest {
	private static byte[] bytes(String str) {
		return str.getBytes(StandardCharsets.ISO_8859_1);
	}

	private static final byte[] WORDS = {0x78, 0x56, 0x34, 0x12, 0, 0, 0, 0};

	private final SegmentedMemoryImage image = SegmentedMemoryImage.of(
		MemorySegment.readOnly(0x1000, bytes("abc\0café\0unterminated")),
		MemorySegment.readOnly(0x3000, WORDS),
		new MemorySegment(0x2000, bytes("rw\0"), true, false));

	@Test
	public void mappedAddresses() {
		assertThat(this.image.isGlobalMemoryAddress(0x1000)).isTrue();
		assertThat(this.image.isGlobalMemoryAddress(0x2002)).isTrue();
		assertThat(this.image.isGlobalMemoryAddress(0x2003)).isFalse();
		assertThat(this.image.isGlobalMemoryAddress(0)).isFalse();
	}

	@Test
	public void segmentPermissions() {
		var text = new MemorySegment(0x400000, new byte[16], false, true);

		assertThat(text.isExecutable()).isTrue();
		assertThat(text.isWriteable()).isFalse();
		assertThat(MemorySegment.readOnly(0x1000, new byte[1]).isExecutable()).isFalse();
		assertThat(this.image.getSegments()).hasSize(3);
	}

	@Test
	public void writeableAddresses() {
		assertThat(this.image.isAddressWriteable(0x2000)).isTrue();
		assertThat(this.image.isAddressWriteable(0x1000)).isFalse();
		assertThat(this.image.isAddressWriteable(0x9000)).isFalse();
	}

	@Test
	public void readStrings() {
		assertThat(this.image.readStringUntilNullTerminator(0x1000)).hasValue("abc");
		assertThat(this.image.readStringUntilNullTerminator(0x1001)).hasValue("bc");
		assertThat(this.image.readStringUntilNullTerminator(0x1003)).hasValue("");
		assertThat(this.image.readStringUntilNullTerminator(0x1004)).hasValue("café");
	}

	@Test
	public void readUnterminatedString() {
		assertThat(this.image.readStringUntilNullTerminator(0x1009)).isEmpty();
		assertThat(this.image.readStringUntilNullTerminator(0x5000)).isEmpty();
	}

	@Test
	public void readAcrossSegmentEnd() {
		assertThat(this.image.read(0x1000, 3)).isPresent();
		assertThat(this.image.read(0x2001, 4)).isEmpty();
	}

	@Test
	public void readPointers() {
		assertThat(this.image.readPointer(0x3000, 8)).isEqualTo(OptionalLong.of(0x12345678));
		assertThat(this.image.readPointer(0x3000, 2)).isEqualTo(OptionalLong.of(0x5678));
		assertThat(this.image.readPointer(0x3004, 8)).isEqualTo(OptionalLong.empty());
	}

	@Test
	public void readBigEndianPointers() {
		var bigEndian = new SegmentedMemoryImage(List.of(MemorySegment.readOnly(0x3000, WORDS)), true);

		assertThat(bigEndian.isBigEndian()).isTrue();
		assertThat(bigEndian.readPointer(0x3000, 4)).isEqualTo(OptionalLong.of(0x78563412));
	}
}
