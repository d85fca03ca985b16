package absstr.analysis.strings;

import absstr.ir.Blk;
import absstr.ir.CallingConvention;
import absstr.ir.Def;
import absstr.ir.Expression;
import absstr.ir.ExternSymbol;
import absstr.ir.Jmp;
import absstr.ir.Program;
import absstr.ir.Project;
import absstr.ir.Sub;
import absstr.ir.Term;
import absstr.ir.Tid;
import absstr.ir.Variable;
import absstr.memory.MemorySegment;
import absstr.memory.SegmentedMemoryImage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A small x86-64 style program used by the tests.
 *
 * <pre>
 * main:
 *   blk0: (defs exercised one by one by the tests)
 *         call strcat, return to blk1
 *   blk1: call callee, return to blk2
 *   blk2: if RAX == 0 goto blk3 else goto blk4
 *   blk3: call exit
 *   blk4: ret
 * callee:
 *   entry: RAX := RDI; ret
 * helper:
 *   h0: call strncpy, return to h1
 *   h1: call puts, return to h2
 *   h2: call [RAX], return to h3
 *   h3: ret
 * </pre>
 */
final class TestPrograms {
	static final Variable RAX = Variable.register("RAX", 8);
	static final Variable RBX = Variable.register("RBX", 8);
	static final Variable RDI = Variable.register("RDI", 8);
	static final Variable RSI = Variable.register("RSI", 8);
	static final Variable RDX = Variable.register("RDX", 8);
	static final Variable RSP = Variable.register("RSP", 8);

	/** "Hello, " */
	static final long HELLO = 0x1000;
	/** "World" */
	static final long WORLD = 0x1008;
	/** A pointer to WORLD. */
	static final long TABLE = 0x1010;
	/** Writeable memory. */
	static final long DATA = 0x2000;

	static final Tid MAIN = Tid.of("sub_main", "0x4000");
	static final Tid CALLEE = Tid.of("sub_callee", "0x5000");
	static final Tid HELPER = Tid.of("sub_helper", "0x6000");

	static final Tid STRCAT = Tid.of("ext_strcat");
	static final Tid STRNCPY = Tid.of("ext_strncpy");
	static final Tid PUTS = Tid.of("ext_puts");
	static final Tid EXIT = Tid.of("ext_exit");

	static final Term<Def> RDI_HELLO = def("def_rdi_hello", Def.assign(RDI, constant(HELLO)));
	static final Term<Def> RSI_WORLD = def("def_rsi_world", Def.assign(RSI, constant(WORLD)));
	static final Term<Def> RAX_RDI = def("def_rax_rdi", Def.assign(RAX, var(RDI)));
	static final Term<Def> RAX_RDI_PLUS_2 = def("def_rax_rdi_2",
		Def.assign(RAX, Expression.binOp(Expression.BinOpType.INT_ADD, var(RDI), constant(2))));
	static final Term<Def> RAX_UNKNOWN = def("def_rax_unknown", Def.assign(RAX, Expression.unknown("rdrand", 8)));
	static final Term<Def> RAX_DATA = def("def_rax_data", Def.assign(RAX, constant(DATA)));
	static final Term<Def> STORE_STACK = def("def_store_stack", Def.store(rspPlus(8), var(RDI)));
	static final Term<Def> LOAD_STACK = def("def_load_stack", Def.load(RAX, rspPlus(8)));
	static final Term<Def> PUSH = def("def_push",
		Def.assign(RSP, Expression.binOp(Expression.BinOpType.INT_SUB, var(RSP), constant(8))));
	static final Term<Def> STORE_RBX = def("def_store_rbx", Def.store(var(RBX), var(RSI)));
	static final Term<Def> STORE_UNKNOWN = def("def_store_unknown", Def.store(Expression.unknown("ptr", 8), var(RSI)));
	static final Term<Def> STORE_DATA = def("def_store_data", Def.store(constant(DATA), var(RDI)));
	static final Term<Def> LOAD_TABLE = def("def_load_table", Def.load(RAX, constant(TABLE)));
	static final Term<Def> STORE_CHAR = def("def_store_char", Def.store(var(RDI), Expression.constant('x', 1)));
	static final Term<Def> STORE_NUL = def("def_store_nul", Def.store(var(RDI), Expression.constant(0, 1)));
	static final Term<Def> STORE_BYTE = def("def_store_byte", Def.store(var(RDI), Expression.unknown("getchar", 1)));

	static final Expression RAX_IS_ZERO = Expression.binOp(Expression.BinOpType.INT_EQUAL, var(RAX), constant(0));

	static final Term<Jmp> CALL_STRCAT = jmp("jmp_call_strcat", Jmp.call(STRCAT, Tid.of("blk_main_1")));
	static final Term<Jmp> CALL_CALLEE = jmp("jmp_call_callee", Jmp.call(CALLEE, Tid.of("blk_main_2")));
	static final Term<Jmp> IF_RAX_ZERO = jmp("jmp_if_rax_zero", Jmp.cbranch(Tid.of("blk_main_3"), RAX_IS_ZERO));
	static final Term<Jmp> ELSE = jmp("jmp_else", Jmp.branch(Tid.of("blk_main_4")));
	static final Term<Jmp> CALL_EXIT = jmp("jmp_call_exit", Jmp.call(EXIT, null));
	static final Term<Jmp> MAIN_RETURN = jmp("jmp_main_ret", Jmp.ret(var(RSP)));

	static final Term<Def> CALLEE_RAX_RDI = def("def_callee_rax_rdi", Def.assign(RAX, var(RDI)));
	static final Term<Jmp> CALLEE_RETURN = jmp("jmp_callee_ret", Jmp.ret(var(RSP)));

	static final Term<Jmp> CALL_STRNCPY = jmp("jmp_call_strncpy", Jmp.call(STRNCPY, Tid.of("blk_helper_1")));
	static final Term<Jmp> CALL_PUTS = jmp("jmp_call_puts", Jmp.call(PUTS, Tid.of("blk_helper_2")));
	static final Term<Jmp> CALL_INDIRECT = jmp("jmp_call_ind", Jmp.callInd(var(RAX), Tid.of("blk_helper_3")));
	static final Term<Jmp> HELPER_RETURN = jmp("jmp_helper_ret", Jmp.ret(var(RSP)));

	static final Term<Blk> MAIN_0 = blk("blk_main_0",
		List.of(RDI_HELLO, RSI_WORLD, RAX_RDI, RAX_RDI_PLUS_2, RAX_UNKNOWN, RAX_DATA, STORE_STACK,
			LOAD_STACK, PUSH, STORE_RBX, STORE_UNKNOWN, STORE_DATA, LOAD_TABLE, STORE_CHAR, STORE_NUL,
			STORE_BYTE),
		List.of(CALL_STRCAT));
	static final Term<Blk> MAIN_1 = blk("blk_main_1", List.of(), List.of(CALL_CALLEE));
	static final Term<Blk> MAIN_2 = blk("blk_main_2", List.of(), List.of(IF_RAX_ZERO, ELSE));
	static final Term<Blk> MAIN_3 = blk("blk_main_3", List.of(), List.of(CALL_EXIT));
	static final Term<Blk> MAIN_4 = blk("blk_main_4", List.of(), List.of(MAIN_RETURN));
	static final Term<Blk> CALLEE_0 = blk("blk_callee_0", List.of(CALLEE_RAX_RDI), List.of(CALLEE_RETURN));
	static final Term<Blk> HELPER_0 = blk("blk_helper_0", List.of(), List.of(CALL_STRNCPY));
	static final Term<Blk> HELPER_1 = blk("blk_helper_1", List.of(), List.of(CALL_PUTS));
	static final Term<Blk> HELPER_2 = blk("blk_helper_2", List.of(), List.of(CALL_INDIRECT));
	static final Term<Blk> HELPER_3 = blk("blk_helper_3", List.of(), List.of(HELPER_RETURN));

	static final Term<Sub> MAIN_SUB = Term.of(MAIN, new Sub("main", List.of(MAIN_0, MAIN_1, MAIN_2, MAIN_3, MAIN_4)));
	static final Term<Sub> CALLEE_SUB = Term.of(CALLEE, new Sub("callee", List.of(CALLEE_0)));
	static final Term<Sub> HELPER_SUB = Term.of(HELPER, new Sub("helper", List.of(HELPER_0, HELPER_1, HELPER_2, HELPER_3)));

	static final CallingConvention CDECL = new CallingConvention("__cdecl",
		List.of(RDI, RSI, RDX),
		List.of(RAX),
		List.of("RBX", "RBP", "RSP", "R12", "R13", "R14", "R15"));

	private TestPrograms() {
	}

	static Expression constant(long value) {
		return Expression.constant(value, 8);
	}

	static Expression var(Variable var) {
		return Expression.var(var);
	}

	static Expression rspPlus(long offset) {
		return Expression.binOp(Expression.BinOpType.INT_ADD, var(RSP), constant(offset));
	}

	private static Term<Def> def(String id, Def def) {
		return Term.of(Tid.of(id), def);
	}

	private static Term<Jmp> jmp(String id, Jmp jmp) {
		return Term.of(Tid.of(id), jmp);
	}

	private static Term<Blk> blk(String id, List<Term<Def>> defs, List<Term<Jmp>> jmps) {
		return Term.of(Tid.of(id), new Blk(defs, jmps));
	}

	static Program program() {
		return new Program(
			List.of(MAIN_SUB, CALLEE_SUB, HELPER_SUB),
			List.of(
				ExternSymbol.of(STRCAT, "strcat"),
				ExternSymbol.of(STRNCPY, "strncpy"),
				ExternSymbol.of(PUTS, "puts"),
				new ExternSymbol(EXIT, "exit", null, List.of(), List.of(), true, false)),
			List.of(MAIN));
	}

	static Project project() {
		return new Project(Term.of(Tid.of("prog"), program()), "x86_64", RSP, List.of(CDECL), "__cdecl");
	}

	static SegmentedMemoryImage memoryImage() {
		var rodata = ByteBuffer.allocate(0x18).order(ByteOrder.LITTLE_ENDIAN);
		rodata.put("Hello, \0".getBytes(StandardCharsets.ISO_8859_1));
		rodata.put("World\0\0\0".getBytes(StandardCharsets.ISO_8859_1));
		rodata.putLong(WORLD);

		var data = "abc\0".getBytes(StandardCharsets.ISO_8859_1);

		return SegmentedMemoryImage.of(
			MemorySegment.readOnly(HELLO, rodata.array()),
			new MemorySegment(DATA, data, true, false));
	}
}
