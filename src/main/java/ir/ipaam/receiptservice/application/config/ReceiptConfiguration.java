package ir.ipaam.receiptservice.application.config;

import ir.ipaam.receiptservice.application.service.receipt.letterhead.LetterheadLocator;
import ir.ipaam.receiptservice.application.service.receipt.render.FontSetFactory;
import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ReceiptProperties.class)
public class ReceiptConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PageGeometry pageGeometry(ReceiptProperties properties) {
        return properties.toGeometry();
    }

    @Bean
    public FontSetFactory fontSetFactory(ReceiptProperties properties, PageGeometry pageGeometry) {
        return new FontSetFactory(properties.getFonts(), pageGeometry.fontSize());
    }

    @Bean
    public LetterheadLocator letterheadLocator(ReceiptProperties properties) {
        return new LetterheadLocator(properties.getLetterhead(), Path.of("").toAbsolutePath());
    }
}
