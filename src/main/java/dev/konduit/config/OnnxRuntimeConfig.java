package dev.konduit.config;

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
 * Initialises the process-wide ONNX Runtime environment before the embedding and scoring model
 * beans exist.
 *
 * <p>The {@link OrtEnvironment} is a singleton that cannot be reconfigured once created, and the
 * bi-encoder's static initialiser creates it on first use. Running as a {@link
 * BeanFactoryPostProcessor} puts this ahead of every model bean. Thread counts come from {@code
 * konduit.onnx.intra-op-threads} and {@code konduit.onnx.inter-op-threads}.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 2;
  private int interOpThreads = 1;

  @Override
  public void setEnvironment(Environment environment) {
    intraOpThreads =
        environment.getProperty("konduit.onnx.intra-op-threads", Integer.class, intraOpThreads);
    interOpThreads =
        environment.getProperty("konduit.onnx.inter-op-threads", Integer.class, interOpThreads);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "konduit", threadingOptions);

      log.info(
          "ONNX Runtime initialized: intra-op={}, inter-op={}", intraOpThreads, interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn("ONNX Runtime environment already initialized, keeping existing threading: {}",
          e.getMessage());
    }
  }
}
