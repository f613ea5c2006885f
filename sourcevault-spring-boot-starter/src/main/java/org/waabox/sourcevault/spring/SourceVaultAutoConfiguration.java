package org.waabox.sourcevault.spring;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.sourcevault.credentials.CredentialResolver;
import org.waabox.sourcevault.credentials.k8s.KubernetesSecretCredentialResolver;
import org.waabox.sourcevault.fetch.SourceFetcher;
import org.waabox.sourcevault.fetch.http.HttpFetcherConfig;
import org.waabox.sourcevault.fetch.http.HttpSourceFetcher;
import org.waabox.sourcevault.metrics.ReconcileMetrics;
import org.waabox.sourcevault.reconcile.ReconcileLoop;
import org.waabox.sourcevault.reconcile.RequeuePolicy;
import org.waabox.sourcevault.reconcile.SourceReconciler;
import org.waabox.sourcevault.source.HelmChartProvider;
import org.waabox.sourcevault.source.HelmRepositoryProvider;
import org.waabox.sourcevault.source.RepositoryIndexReader;
import org.waabox.sourcevault.source.SourceProvider;
import org.waabox.sourcevault.storage.ArtifactStorage;
import org.waabox.sourcevault.storage.fs.FileSystemArtifactStorage;
import org.waabox.sourcevault.storage.fs.FileSystemStorageConfig;
import org.waabox.sourcevault.store.InMemoryResourceStore;
import org.waabox.sourcevault.store.ResourceStore;

/**
 * Spring Boot auto-configuration for the SourceVault artifact cache.
 *
 * <p>This configuration wires a {@link SourceReconciler} over a file
 * system {@link ArtifactStorage}, an HTTP {@link SourceFetcher} and an
 * in-memory {@link ResourceStore}, each replaceable by an application bean
 * of the same type. The chart repository and chart providers are always
 * registered; {@link SourceProvider} beans add kinds or replace them.
 *
 * <p>All {@link SourceRegistrar} beans are invoked to declare their sources
 * in the default store. The {@link ReconcileLoop} is started and stopped
 * through Spring's {@link SmartLifecycle}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(SourceVaultProperties.class)
public class SourceVaultAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SourceVaultAutoConfiguration.class);

  /**
   * Creates the file system artifact storage.
   *
   * @param properties the configuration properties, never null
   * @return the storage, never null
   */
  @Bean
  @ConditionalOnMissingBean(ArtifactStorage.class)
  public ArtifactStorage sourceVaultArtifactStorage(
      final SourceVaultProperties properties) {
    final FileSystemStorageConfig config = FileSystemStorageConfig.builder()
        .root(Path.of(properties.getStoragePath()))
        .hostname(properties.getHostname())
        .fileMode(properties.fileModeBits())
        .build();
    log.info("SourceVault storing artifacts under {} served at {}",
        config.root(), config.hostname());
    return new FileSystemArtifactStorage(config);
  }

  /**
   * Creates the HTTP source fetcher.
   *
   * @return the fetcher, never null
   */
  @Bean
  @ConditionalOnMissingBean(SourceFetcher.class)
  public SourceFetcher sourceVaultSourceFetcher() {
    return new HttpSourceFetcher(HttpFetcherConfig.create());
  }

  /**
   * Creates the in-memory resource store and invokes every registrar.
   *
   * @param registrars the source registrars, may be empty
   * @return the store, never null
   */
  @Bean
  @ConditionalOnMissingBean(ResourceStore.class)
  public InMemoryResourceStore sourceVaultResourceStore(
      final ObjectProvider<SourceRegistrar> registrars) {
    final InMemoryResourceStore store = new InMemoryResourceStore();
    registrars.orderedStream().forEach(registrar -> {
      registrar.register(store);
      log.debug("Invoked SourceRegistrar: {}",
          registrar.getClass().getSimpleName());
    });
    log.info("SourceVault declared {} source(s)", store.list().size());
    return store;
  }

  /**
   * Creates the requeue policy from the properties.
   *
   * @param properties the configuration properties, never null
   * @return the policy, never null
   */
  @Bean
  @ConditionalOnMissingBean(RequeuePolicy.class)
  public RequeuePolicy sourceVaultRequeuePolicy(
      final SourceVaultProperties properties) {
    return RequeuePolicy.of(properties.getRetryInterval(),
        properties.getDefaultTimeout());
  }

  /**
   * Creates the reconciler.
   *
   * @param storage             the artifact storage, never null
   * @param store               the resource store, never null
   * @param fetcher             the source fetcher, never null
   * @param requeuePolicy       the requeue policy, never null
   * @param credentialsProvider provider for an optional CredentialResolver
   * @param metricsProvider     provider for an optional ReconcileMetrics
   * @param providers           provider for additional SourceProviders
   * @return the reconciler, never null
   */
  @Bean
  @ConditionalOnMissingBean(SourceReconciler.class)
  public SourceReconciler sourceVaultReconciler(
      final ArtifactStorage storage,
      final ResourceStore store,
      final SourceFetcher fetcher,
      final RequeuePolicy requeuePolicy,
      final ObjectProvider<CredentialResolver> credentialsProvider,
      final ObjectProvider<ReconcileMetrics> metricsProvider,
      final ObjectProvider<SourceProvider> providers) {

    requireAtMostOne(credentialsProvider, CredentialResolver.class);

    final SourceReconciler.Builder builder = SourceReconciler.builder()
        .storage(storage)
        .store(store)
        .requeuePolicy(requeuePolicy)
        .provider(new HelmRepositoryProvider(fetcher))
        .provider(new HelmChartProvider(fetcher,
            new RepositoryIndexReader(store, storage)));

    providers.orderedStream().forEach(provider -> {
      builder.provider(provider);
      log.info("SourceVault using custom SourceProvider for {}: {}",
          provider.kind().kindName(), provider.getClass().getSimpleName());
    });

    credentialsProvider.ifAvailable(resolver -> {
      builder.credentials(resolver);
      log.info("SourceVault using CredentialResolver: {}",
          resolver.getClass().getSimpleName());
    });

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("SourceVault using custom ReconcileMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    return builder.build();
  }

  /**
   * Creates the reconcile loop.
   *
   * @param reconciler the reconciler, never null
   * @param store      the resource store, never null
   * @param properties the configuration properties, never null
   * @return the loop, never null
   */
  @Bean
  @ConditionalOnMissingBean(ReconcileLoop.class)
  public ReconcileLoop sourceVaultReconcileLoop(
      final SourceReconciler reconciler, final ResourceStore store,
      final SourceVaultProperties properties) {
    return new ReconcileLoop(reconciler, store,
        properties.getMaxConcurrentReconciles());
  }

  /**
   * Creates a {@link SmartLifecycle} bean that runs the reconcile loop.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * to ensure all other beans are initialized first, and stops early
   * for the same reason.
   *
   * @param loop the reconcile loop, never null
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle sourceVaultLifecycle(final ReconcileLoop loop) {
    return new SmartLifecycle() {

      @Override
      public void start() {
        log.info("Starting SourceVault reconcile loop...");
        loop.start();
      }

      @Override
      public void stop() {
        log.info("Stopping SourceVault reconcile loop...");
        loop.stop();
      }

      @Override
      public boolean isRunning() {
        return loop.isRunning();
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "SourceVault requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }

  /**
   * Resolves secret references from the Kubernetes API when
   * {@code sourcevault.kubernetes-secrets} is true.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "sourcevault", name = "kubernetes-secrets",
      havingValue = "true")
  static class KubernetesCredentialsConfiguration {

    /**
     * Creates the Kubernetes secret resolver on the default client.
     *
     * @return the resolver, never null
     */
    @Bean
    @ConditionalOnMissingBean(CredentialResolver.class)
    CredentialResolver sourceVaultKubernetesCredentials() {
      log.info("SourceVault resolving secrets from the Kubernetes API");
      return KubernetesSecretCredentialResolver.fromDefaultClient();
    }
  }
}
