package defi.protocol.orderbook.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatis configuration class
 * Configures mapper scanning and the shared JSON mapper
 */
@Configuration
@MapperScan("defi.protocol.orderbook.mapper")
public class MyBatisConfig {

    /**
     * Configure Jackson ObjectMapper bean for JSON serialization
     * Timestamps are written as ISO-8601 strings
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
