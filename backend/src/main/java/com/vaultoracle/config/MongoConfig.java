package com.vaultoracle.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.util.List;

/**
 * Vault amounts and proof prices are stored as Decimal128 and read back as BigDecimal.
 * Indexes come from @CompoundIndex / @Indexed on the domain documents.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(AmountWritingConverter.INSTANCE, AmountReadingConverter.INSTANCE));
    }

    /**
     * Rejects values Decimal128 would round (more than 34 significant digits); on-chain amounts must be stored exactly.
     */
    @WritingConverter
    enum AmountWritingConverter implements Converter<BigDecimal, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigDecimal source) {
            if (source.precision() > 34) {
                throw new IllegalArgumentException("Amount " + source.toPlainString() + " exceeds Decimal128 precision");
            }
            return new Decimal128(source);
        }
    }

    @ReadingConverter
    enum AmountReadingConverter implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }
}
