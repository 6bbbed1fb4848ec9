package io.b2mash.secops.bridge.tool;

import io.b2mash.secops.bridge.exception.InvalidToolArgumentException;
import io.b2mash.secops.bridge.exception.ToolExecutionException;
import io.b2mash.secops.bridge.exception.ToolNotFoundException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;

@Component
public class ToolRegistry {

  private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

  // Built at startup: prefixed tool name -> descriptor, in registration order
  private final Map<String, ToolDescriptor> tools = new LinkedHashMap<>();
  private final Map<String, ResourceDescriptor> resources = new LinkedHashMap<>();
  private final TreeSet<String> activeModules = new TreeSet<>();

  private final String toolPrefix;

  public ToolRegistry(ApplicationContext applicationContext, BridgeProperties properties) {
    this.toolPrefix = properties.toolPrefix();

    // Scan for all beans with @ToolModuleComponent.
    // Fail fast if two modules share a name or register the same tool.
    applicationContext
        .getBeansWithAnnotation(ToolModuleComponent.class)
        .forEach(
            (beanName, bean) -> {
              var annotation =
                  AnnotationUtils.findAnnotation(bean.getClass(), ToolModuleComponent.class);
              var moduleName = annotation.name();
              if (!(bean instanceof ToolModule module)) {
                throw new IllegalStateException(
                    "@ToolModuleComponent bean "
                        + bean.getClass().getName()
                        + " does not implement "
                        + ToolModule.class.getName());
              }
              if (!properties.isEnabled(moduleName)) {
                log.debug("Skipping disabled module: {}", moduleName);
                return;
              }
              if (!activeModules.add(moduleName)) {
                throw new IllegalStateException("Duplicate tool module name: " + moduleName);
              }
              var registrar = new ModuleRegistrar(moduleName);
              module.registerTools(registrar);
              module.registerResources(registrar);
            });

    for (String requested : properties.enabledModules()) {
      if (!activeModules.contains(requested)) {
        log.warn("Enabled module {} is not available", requested);
      }
    }

    log.info(
        "Initialized {} modules with {} tools and {} resources",
        activeModules.size(),
        tools.size(),
        resources.size());
  }

  public List<ToolDescriptor> tools() {
    return List.copyOf(tools.values());
  }

  public List<ResourceDescriptor> resources() {
    return List.copyOf(resources.values());
  }

  public List<String> activeModules() {
    return List.copyOf(activeModules);
  }

  public ToolDescriptor tool(String name) {
    var tool = tools.get(name);
    if (tool == null) {
      throw new ToolNotFoundException(name);
    }
    return tool;
  }

  public ResourceDescriptor resource(String uri) {
    var resource = resources.get(uri);
    if (resource == null) {
      throw ToolNotFoundException.forResource(uri);
    }
    return resource;
  }

  /**
   * Runs a tool. Remote failures come back as values inside the result; only invalid arguments
   * and unexpected handler failures are thrown.
   */
  public Object invoke(String name, Map<String, Object> arguments) {
    var tool = tool(name);
    log.debug("Invoking tool {}", name);
    try {
      return tool.handler().handle(ToolArguments.of(arguments));
    } catch (InvalidToolArgumentException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ToolExecutionException(name, e);
    }
  }

  private final class ModuleRegistrar implements ToolRegistrar {

    private final String moduleName;

    private ModuleRegistrar(String moduleName) {
      this.moduleName = moduleName;
    }

    @Override
    public void addTool(String name, String description, ToolHandler handler) {
      var prefixed = toolPrefix + name;
      var existing =
          tools.putIfAbsent(
              prefixed, new ToolDescriptor(prefixed, moduleName, description, handler));
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate tool "
                + prefixed
                + " registered by modules "
                + existing.module()
                + " and "
                + moduleName);
      }
      log.debug("Added tool: {}", prefixed);
    }

    @Override
    public void addResource(String uri, String name, String description, String text) {
      var existing =
          resources.putIfAbsent(
              uri, new ResourceDescriptor(uri, toolPrefix + name, moduleName, description, text));
      if (existing != null) {
        throw new IllegalStateException("Duplicate resource " + uri);
      }
      log.debug("Added resource: {}", uri);
    }
  }
}
