package com.NTG.mawarith.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Juristic switches. Defined in application.yml under 'mawarith'.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "mawarith")
public class MawarithProperties {

    // اختلاف الدين مانع من موانع الإرث
    private boolean religionImpediment = true;

    // الغراوان: للأم ثلث الباقي مع الزوج والأب
    private boolean umariyya = true;
}
