package dev.scriptorium.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Configures the ONNX Runtime environment before any ONNX model bean is created.
 *
 * <p>Implemented as a {@link BeanFactoryPostProcessor} because the {@link OrtEnvironment} is a
 * singleton that cannot be reconfigured after the first model touches it. Thread counts come from
 * {@code scriptorium.onnx.intra-op-threads} and {@code scriptorium.onnx.inter-op-threads}; they are
 * read from the {@link Environment} directly since properties beans do not exist yet at this stage.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 4;
  private int interOpThreads = 2;

  @Override
  public void setEnvironment(Environment environment) {
    this.intraOpThreads =
        environment.getProperty("scriptorium.onnx.intra-op-threads", Integer.class, 4);
    this.interOpThreads =
        environment.getProperty("scriptorium.onnx.inter-op-threads", Integer.class, 2);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "scriptorium", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
