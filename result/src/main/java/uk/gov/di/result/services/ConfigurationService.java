package uk.gov.di.result.services;

public class ConfigurationService {

    private static ConfigurationService configurationService;

    public static ConfigurationService getInstance() {
        if (configurationService == null) {
            configurationService = new ConfigurationService();
        }
        return configurationService;
    }

    public ConfigurationService() {}

    /** Threads in the default async result pool. Zero or less selects the common pool. */
    public int getAsyncResultPoolSize() {
        return Integer.parseInt(System.getenv().getOrDefault("ASYNC_RESULT_POOL_SIZE", "0"));
    }

    public String getAsyncResultThreadNamePrefix() {
        return System.getenv().getOrDefault("ASYNC_RESULT_THREAD_NAME_PREFIX", "async-result-");
    }
}
