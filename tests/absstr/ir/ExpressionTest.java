package absstr.ir;

import static com.google.common.truth.Truth.assertThat;

import absstr.ir.Expression.BinOpType;
import absstr.ir.Expression.CastOpType;
import absstr.ir.Expression.UnOpType;

import java.util.OptionalLong;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link Expression}.
 */
@RunWith(JUnit4.class)
public class ExpressionTest {
	private static final Variable RSP = Variable.register("RSP", 8);
	private static final Variable EAX = Variable.register("EAX", 4);

	private static Expression c8(long value) {
		return Expression.constant(value, 8);
	}

	private static Expression c4(long value) {
		return Expression.constant(value, 4);
	}

	@Test
	public void constantsAreMasked() {
		assertThat(c4(-1).evaluateConstant()).isEqualTo(OptionalLong.of(0xFFFFFFFFL));
		assertThat(Expression.constant(0x1234, 1).evaluateConstant()).isEqualTo(OptionalLong.of(0x34));
	}

	@Test
	public void arithmetic() {
		var sum = Expression.binOp(BinOpType.INT_ADD, c8(0x1000), c8(0x10));
		assertThat(sum.evaluateConstant()).isEqualTo(OptionalLong.of(0x1010));

		var wrapped = Expression.binOp(BinOpType.INT_ADD, c4(0xFFFFFFFFL), c4(2));
		assertThat(wrapped.evaluateConstant()).isEqualTo(OptionalLong.of(1));

		var shifted = Expression.binOp(BinOpType.INT_LEFT, c8(1), c8(4));
		assertThat(shifted.evaluateConstant()).isEqualTo(OptionalLong.of(16));
	}

	@Test
	public void comparisons() {
		var unsigned = Expression.binOp(BinOpType.INT_LESS, c4(1), c4(-1));
		assertThat(unsigned.getSize()).isEqualTo(1);
		assertThat(unsigned.evaluateConstant()).isEqualTo(OptionalLong.of(1));

		var signed = Expression.binOp(BinOpType.INT_SLESS, c4(1), c4(-1));
		assertThat(signed.evaluateConstant()).isEqualTo(OptionalLong.of(0));

		var equal = Expression.binOp(BinOpType.INT_EQUAL, c8(3), c8(3));
		assertThat(equal.evaluateConstant()).isEqualTo(OptionalLong.of(1));
	}

	@Test
	public void unaryAndCasts() {
		assertThat(Expression.unOp(UnOpType.INT_2COMP, c4(1)).evaluateConstant())
			.isEqualTo(OptionalLong.of(0xFFFFFFFFL));
		assertThat(Expression.unOp(UnOpType.BOOL_NEGATE, Expression.constant(0, 1)).evaluateConstant())
			.isEqualTo(OptionalLong.of(1));
		assertThat(Expression.cast(CastOpType.INT_SEXT, 8, Expression.constant(0x80, 1)).evaluateConstant())
			.isEqualTo(OptionalLong.of(0xFFFFFFFFFFFFFF80L));
		assertThat(Expression.cast(CastOpType.INT_ZEXT, 8, Expression.constant(0x80, 1)).evaluateConstant())
			.isEqualTo(OptionalLong.of(0x80));
	}

	@Test
	public void pieceAndSubpiece() {
		var piece = Expression.binOp(BinOpType.PIECE, c4(0x12345678), c4(0x9ABCDEF0L));
		assertThat(piece.getSize()).isEqualTo(8);
		assertThat(piece.evaluateConstant()).isEqualTo(OptionalLong.of(0x123456789ABCDEF0L));

		var sub = Expression.subpiece(4, 2, c8(0x123456789ABCDEF0L));
		assertThat(sub.evaluateConstant()).isEqualTo(OptionalLong.of(0x5678));
	}

	@Test
	public void unknownOperandsAreNotConstant() {
		var sum = Expression.binOp(BinOpType.INT_ADD, Expression.var(RSP), c8(8));
		assertThat(sum.evaluateConstant().isPresent()).isFalse();
		assertThat(Expression.unknown("rdtsc", 8).evaluateConstant().isPresent()).isFalse();
	}

	@Test
	public void pointers() {
		assertThat(Expression.var(RSP).asPointer()).hasValue(new Expression.Pointer(RSP, 0));

		var plus = Expression.binOp(BinOpType.INT_ADD, Expression.var(RSP), c8(0x10));
		assertThat(plus.asPointer()).hasValue(new Expression.Pointer(RSP, 0x10));

		var minus = Expression.binOp(BinOpType.INT_SUB, Expression.var(RSP), c8(8));
		assertThat(minus.asPointer()).hasValue(new Expression.Pointer(RSP, -8));

		var negative = Expression.binOp(BinOpType.INT_ADD, Expression.var(EAX), c4(0xFFFFFFFCL));
		assertThat(negative.asPointer()).hasValue(new Expression.Pointer(EAX, -4));

		var swapped = Expression.binOp(BinOpType.INT_ADD, c8(4), Expression.var(RSP));
		assertThat(swapped.asPointer()).hasValue(new Expression.Pointer(RSP, 4));
	}

	@Test
	public void notPointers() {
		assertThat(c8(0x1000).asPointer()).isEmpty();
		assertThat(Expression.binOp(BinOpType.INT_MULT, Expression.var(RSP), c8(2)).asPointer()).isEmpty();
		assertThat(Expression.binOp(BinOpType.INT_SUB, c8(8), Expression.var(RSP)).asPointer()).isEmpty();
	}
}
