package com.example.auditchain.config;

import com.example.auditchain.keys.KeyMaterial;
import com.example.auditchain.keys.KeyMaterialManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads key material once at start-up. A storage or format failure aborts context refresh.
 */
@Configuration
public class KeyMaterialConfig {
    @Bean
    public KeyMaterial keyMaterial(KeyMaterialManager keyMaterialManager) {
        return keyMaterialManager.load();
    }
}
