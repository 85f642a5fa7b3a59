package io.compositor.di;

import io.compositor.di.plan.FactoryCompiler;
import io.compositor.di.plan.Node;
import io.compositor.di.plan.NodeApply;
import io.compositor.di.plan.NodeConstructor;
import io.compositor.di.plan.NodePlaceholder;
import io.compositor.di.plan.Nodes;
import io.compositor.di.plan.PlaceholderReplacer;
import io.compositor.di.resolve.DefaultParameterResolutionPolicy;
import org.junit.Before;
import org.junit.Test;

import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;
import static org.junit.Assert.*;

public final class RegistrationTest {
	public interface Repository {
	}

	public static final class InMemoryRepository implements Repository {
		private final List<String> initializedBy = new ArrayList<>();
	}

	public static final class LoggingRepository implements Repository {
		private final Repository delegate;

		public LoggingRepository(Repository delegate) {
			this.delegate = delegate;
		}
	}

	public static final class Clock {
	}

	public static final class Service {
		private final Repository repository;
		private final String name;

		public Service(Repository repository, String name) {
			this.repository = repository;
			this.name = name;
		}
	}

	public static final class Scheduler {
		private final Repository repository;
		private final Clock clock;

		public Scheduler(Repository repository, Clock clock) {
			this.repository = repository;
			this.clock = clock;
		}
	}

	private Container container;

	@Before
	public void setUp() {
		container = new Container();
	}

	private static Parameter parameter(Class<?> type, int index) {
		return type.getConstructors()[0].getParameters()[index];
	}

	private static Map<Parameter, Node> nameOverride(String name) {
		Map<Parameter, Node> overrides = new HashMap<>();
		overrides.put(parameter(Service.class, 1), Nodes.constant(name, String.class));
		return overrides;
	}

	private Registration registration(Class<?> serviceType) {
		Registration registration = container.getRegistrationEvenIfInvalid(serviceType);
		assertNotNull(registration);
		return registration;
	}

	@Test
	public void delegateReturningNullFailsOnCreation() {
		container.register(Repository.class, () -> null);

		try {
			container.getInstance(Repository.class);
			fail("should've failed");
		} catch (ActivationException e) {
			assertTrue(e.getMessage().contains("returned null"));
			assertTrue(e.getMessage().contains(Repository.class.getName()));
		}
	}

	@Test
	public void overrideAlwaysWins() {
		InMemoryRepository sentinel = new InMemoryRepository();
		Map<Parameter, Node> overrides = nameOverride("sentinel");
		overrides.put(parameter(Service.class, 0), Nodes.constant(sentinel, Repository.class));
		container.register(Repository.class, InMemoryRepository.class);
		container.register(Service.class, Service.class, Lifestyle.TRANSIENT, overrides);

		Service service = container.getInstance(Service.class);

		assertSame(sentinel, service.repository);
		assertEquals("sentinel", service.name);
	}

	@Test
	public void interceptorRunsOnceAndSeesPlaceholders() {
		container.register(Repository.class, InMemoryRepository.class);
		container.register(Service.class, Service.class, Lifestyle.TRANSIENT, nameOverride("service"));

		List<Node> intercepted = new ArrayList<>();
		NodePlaceholder foreignPlaceholder = Nodes.placeholder(String.class);
		container.addExpressionBuildingListener((registration, serviceType, implementationType, node) -> {
			if (serviceType != Service.class) {
				return node;
			}
			intercepted.add(node);
			Node rewritten = PlaceholderReplacer.replace(node, foreignPlaceholder, Nodes.constant("foreign", String.class));
			assertSame(node, rewritten);
			return rewritten;
		});

		Node plan = registration(Service.class).buildExpression();

		assertEquals(1, intercepted.size());
		NodeConstructor seen = (NodeConstructor) intercepted.get(0);
		assertTrue(seen.getArguments().get(1) instanceof NodePlaceholder);
		assertNotEquals(foreignPlaceholder, seen.getArguments().get(1));

		NodeConstructor built = (NodeConstructor) plan;
		assertEquals(Nodes.constant("service", String.class), built.getArguments().get(1));
		assertEquals("service", FactoryCompiler.compile(plan, Service.class).create().name);

		registration(Service.class).buildExpression();
		assertEquals(2, intercepted.size());
	}

	@Test
	public void interceptorsAreChainedInRegistrationOrder() {
		container.register(Repository.class, InMemoryRepository.class);
		List<String> calls = new ArrayList<>();
		container.addExpressionBuildingListener((registration, serviceType, implementationType, node) -> {
			calls.add("first");
			return Nodes.apply(node, Repository.class, instance -> new LoggingRepository((Repository) instance), "log");
		});
		container.addExpressionBuildingListener((registration, serviceType, implementationType, node) -> {
			calls.add("second");
			assertEquals("log", ((NodeApply) node).getName());
			return node;
		});

		Repository repository = container.getInstance(Repository.class);

		assertEquals(asList("first", "second"), calls);
		assertTrue(repository instanceof LoggingRepository);
		assertTrue(((LoggingRepository) repository).delegate instanceof InMemoryRepository);
	}

	@Test
	public void interceptorReturningNullFails() {
		container.register(Repository.class, InMemoryRepository.class);
		container.addExpressionBuildingListener((registration, serviceType, implementationType, node) -> null);

		try {
			registration(Repository.class).buildExpression();
			fail("should've failed");
		} catch (ActivationException e) {
			assertTrue(e.getMessage().contains("returned null"));
		}
	}

	@Test
	public void initializersAreAppliedInRegistrationOrder() {
		container.register(Repository.class, InMemoryRepository.class);
		container.registerInitializer(Repository.class, repository -> ((InMemoryRepository) repository).initializedBy.add("Repository"));
		container.registerInitializer(InMemoryRepository.class, repository -> repository.initializedBy.add("InMemoryRepository"));
		container.registerInitializer(Clock.class, clock -> fail("should not be applied"));

		InMemoryRepository repository = (InMemoryRepository) container.getInstance(Repository.class);

		assertEquals(asList("Repository", "InMemoryRepository"), repository.initializedBy);
	}

	@Test
	public void initializerSeesInterceptedInstance() {
		container.register(Repository.class, InMemoryRepository::new);
		List<Repository> initialized = new ArrayList<>();
		container.registerInitializer(Repository.class, initialized::add);
		container.addExpressionBuildingListener((registration, serviceType, implementationType, node) ->
				Nodes.apply(node, Repository.class, instance -> new LoggingRepository((Repository) instance), "log"));

		Repository repository = container.getInstance(Repository.class);

		assertEquals(singletonList(repository), initialized);
		assertTrue(repository instanceof LoggingRepository);
	}

	@Test
	public void initializerFailureIsWrapped() {
		container.register(Repository.class, InMemoryRepository.class);
		IllegalStateException failure = new IllegalStateException("not ready");
		container.registerInitializer(Repository.class, repository -> {
			throw failure;
		});

		try {
			container.getInstance(Repository.class);
			fail("should've failed");
		} catch (ActivationException e) {
			assertSame(failure, e.getCause());
			assertTrue(e.getMessage().contains(InMemoryRepository.class.getName()));
		}
	}

	@Test
	public void initializerErrorIsNotWrapped() {
		container.register(Repository.class, InMemoryRepository.class);
		AssertionError failure = new AssertionError("broken");
		container.registerInitializer(Repository.class, repository -> {
			throw failure;
		});

		try {
			container.getInstance(Repository.class);
			fail("should've failed");
		} catch (AssertionError e) {
			assertSame(failure, e);
		}
	}

	@Test
	public void initializerIsNotCalledWhenDelegateReturnsNull() {
		container.register(Repository.class, () -> null);
		List<Repository> initialized = new ArrayList<>();
		container.registerInitializer(Repository.class, initialized::add);

		try {
			container.getInstance(Repository.class);
			fail("should've failed");
		} catch (ActivationException e) {
			assertTrue(e.getMessage().contains("returned null"));
		}

		assertTrue(initialized.isEmpty());
	}

	@Test
	public void constructorInitializerRunsOnceOnInterceptedInstance() {
		container.register(Repository.class, InMemoryRepository.class);
		List<Repository> initialized = new ArrayList<>();
		container.registerInitializer(Repository.class, initialized::add);
		container.addExpressionBuildingListener((registration, serviceType, implementationType, node) ->
				Nodes.apply(node, Repository.class, instance -> new LoggingRepository((Repository) instance), "log"));

		Repository repository = container.getInstance(Repository.class);

		assertTrue(repository instanceof LoggingRepository);
		assertTrue(((LoggingRepository) repository).delegate instanceof InMemoryRepository);
		assertEquals(1, initialized.size());
		assertSame(repository, initialized.get(0));
	}

	@Test
	public void onlyRegisteredDependenciesAreRecorded() {
		container.register(Repository.class, InMemoryRepository.class);
		container.register(Scheduler.class, Scheduler.class);
		DefaultParameterResolutionPolicy defaultPolicy = new DefaultParameterResolutionPolicy(container);
		container.getOptions().setParameterResolutionPolicy(parameter -> parameter.getType() == Clock.class ?
				Nodes.constant(new Clock(), Clock.class) :
				defaultPolicy.buildParameterNode(parameter));

		Registration scheduler = registration(Scheduler.class);
		scheduler.buildExpression();

		KnownRelationship[] relationships = scheduler.getRelationships();
		assertEquals(1, relationships.length);
		assertEquals(Scheduler.class, relationships[0].getImplementationType());
		assertEquals(Lifestyle.TRANSIENT, relationships[0].getLifestyle());
		assertSame(registration(Repository.class), relationships[0].getDependency());
	}

	@Test
	public void rebuildReplacesRelationships() {
		container.register(Repository.class, InMemoryRepository.class);
		container.register(Service.class, Service.class, Lifestyle.TRANSIENT, nameOverride("first"));
		Registration service = registration(Service.class);
		service.addRelationship(new KnownRelationship(Clock.class, Lifestyle.TRANSIENT, registration(Repository.class)));

		service.buildExpression();
		KnownRelationship[] relationships = service.getRelationships();

		assertEquals(1, relationships.length);
		assertEquals(Service.class, relationships[0].getImplementationType());

		service.setParameterOverrides(nameOverride("second"));
		Node plan = service.buildExpression();

		assertEquals(1, service.getRelationships().length);
		assertEquals("second", FactoryCompiler.compile(plan, Service.class).create().name);
	}

	@Test
	public void repeatedBuildsAreStructurallyEquivalent() {
		container.register(Repository.class, InMemoryRepository.class);
		container.register(Service.class, Service.class, Lifestyle.TRANSIENT, nameOverride("service"));

		Node first = registration(Service.class).buildExpression();
		Node second = registration(Service.class).buildExpression();
		assertEquals(first, second);

		Service firstInstance = FactoryCompiler.compile(first, Service.class).create();
		Service secondInstance = FactoryCompiler.compile(second, Service.class).create();
		assertNotSame(firstInstance, secondInstance);
		assertNotSame(firstInstance.repository, secondInstance.repository);
		assertEquals(firstInstance.repository.getClass(), secondInstance.repository.getClass());
		assertEquals(firstInstance.name, secondInstance.name);
	}

	@Test
	public void parameterPolicyReturningNullFails() {
		container.register(Service.class, Service.class);
		container.getOptions().setParameterResolutionPolicy(parameter -> null);

		try {
			registration(Service.class).buildExpression();
			fail("should've failed");
		} catch (ActivationException e) {
			assertTrue(e.getMessage().contains("returned null"));
		}
	}

	@Test
	public void unresolvableParameterFails() {
		container.register(Service.class, Service.class, Lifestyle.TRANSIENT, nameOverride("service"));

		try {
			container.getInstance(Service.class);
			fail("should've failed");
		} catch (ActivationException e) {
			assertTrue(e.getMessage().contains(Repository.class.getName()));
		}
	}

	@Test
	public void mismatchedOverrideFailsCompilation() {
		container.register(Repository.class, InMemoryRepository.class);
		Map<Parameter, Node> overrides = new HashMap<>();
		overrides.put(parameter(Service.class, 1), Nodes.constant(42));
		container.register(Service.class, Service.class, Lifestyle.TRANSIENT, overrides);

		try {
			container.getInstance(Service.class);
			fail("should've failed");
		} catch (ActivationException e) {
			assertTrue(e.getMessage().contains(Service.class.getName()));
			assertTrue(e.getMessage().contains("constant(42)"));
		}
	}

	@Test
	public void overrideForForeignParameterIsInert() {
		container.register(Repository.class, InMemoryRepository.class);
		Map<Parameter, Node> overrides = nameOverride("service");
		overrides.put(parameter(Scheduler.class, 0), Nodes.constant("unused", String.class));
		container.register(Service.class, Service.class, Lifestyle.TRANSIENT, overrides);

		Service service = container.getInstance(Service.class);

		assertTrue(service.repository instanceof InMemoryRepository);
	}
}
