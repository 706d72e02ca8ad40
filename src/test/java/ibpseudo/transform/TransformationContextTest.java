package ibpseudo.transform;

import ibpseudo.ast.SourceLocation;
import ibpseudo.ast.java.JavaTypeRef;
import ibpseudo.rules.RuleTable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TransformationContextTest {
	private static final JavaTypeRef DOUBLE = new JavaTypeRef("double", 0, SourceLocation.START);
	private static final JavaTypeRef INT = new JavaTypeRef("int", 0, SourceLocation.START);

	@Test
	void innerScopeShadowsOuter() {
		TransformationContext context = new TransformationContext(new RuleTable());
		context.declareVariable("rate", INT);

		context.pushScope(Scope.Kind.METHOD, "f");
		context.declareVariable("rate", DOUBLE);
		assertTrue(context.lookupVariable("rate").orElseThrow().isReal());
		assertEquals(Scope.Kind.METHOD, context.lookupVariable("rate").orElseThrow().declaredIn());

		context.popScope();
		assertFalse(context.lookupVariable("rate").orElseThrow().isReal());
	}

	@Test
	void resolvesUndeclaredNamesByConversion() {
		TransformationContext context = new TransformationContext(new RuleTable());

		assertEquals("ITEM_COUNT", context.resolveName("itemCount"));
		assertTrue(context.lookupVariable("itemCount").isEmpty());
	}

	@Test
	void innermostBreakTargetWins() {
		TransformationContext context = new TransformationContext(new RuleTable());
		assertFalse(context.breaksOutOfSwitch());

		context.enterSwitch();
		assertTrue(context.breaksOutOfSwitch());
		context.enterLoop();
		assertFalse(context.breaksOutOfSwitch());
		context.exitBreakTarget();
		assertTrue(context.breaksOutOfSwitch());
	}

	@Test
	void guardsAgainstUnbalancedState() {
		TransformationContext context = new TransformationContext(new RuleTable());

		assertThrows(IllegalStateException.class, context::dedent);
		assertThrows(IllegalStateException.class, context::popScope);
	}

	@Test
	void arrayOfDoublesHasRealElements() {
		VariableInfo info = new VariableInfo("xs", "XS", new JavaTypeRef("double", 1, SourceLocation.START),
				Scope.Kind.BLOCK);

		assertTrue(info.hasRealElements());
		assertFalse(info.isReal());
	}
}
