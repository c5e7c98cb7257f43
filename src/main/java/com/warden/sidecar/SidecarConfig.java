package com.warden.sidecar;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.sidecar.platform.FileOutputCapture;
import com.warden.sidecar.platform.OsFamily;
import com.warden.sidecar.platform.OutputCaptureFactory;
import com.warden.sidecar.platform.PipeOutputCapture;
import com.warden.sidecar.platform.ProcessKiller;
import com.warden.sidecar.platform.SystemCommandRunner;
import com.warden.sidecar.platform.UnixProcessKiller;
import com.warden.sidecar.platform.WindowsProcessKiller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the platform strategies from {@code warden.sidecar.platform}.
 */
@Configuration
public class SidecarConfig {

    private static final Logger log = LoggerFactory.getLogger(SidecarConfig.class);

    @Bean
    public OsFamily sidecarOsFamily(SidecarProperties properties) {
        OsFamily family = OsFamily.resolve(properties.getPlatform());
        log.info("Sidecar platform: {}", family);
        return family;
    }

    @Bean
    public SystemCommandRunner systemCommandRunner(SidecarProperties properties) {
        return new SystemCommandRunner(properties.getCommandTimeout());
    }

    @Bean
    public ProcessKiller processKiller(OsFamily family, SystemCommandRunner runner, SidecarProperties properties,
                                      ObjectMapper objectMapper) {
        return switch (family) {
            case WINDOWS -> new WindowsProcessKiller(runner, properties.effectiveSignature(), objectMapper);
            case UNIX -> new UnixProcessKiller(runner, properties.effectiveSignature());
        };
    }

    @Bean
    public OutputCaptureFactory outputCaptureFactory(OsFamily family) {
        return switch (family) {
            case WINDOWS -> FileOutputCapture::new;
            case UNIX -> PipeOutputCapture::new;
        };
    }
}
