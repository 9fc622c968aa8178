package com.gt.flashcards.conf;

import com.gt.flashcards.serialization.StoreObjectMapperFactory;
import com.gt.flashcards.storage.FlashcardStorage;
import com.gt.flashcards.storage.impl.FileFlashcardStorage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class BeanConfig {

    @Bean
    public Clock getClock() {
        return Clock.systemDefaultZone();
    }

    // A corrupt file fails the load, which aborts startup
    @Bean
    public FlashcardStorage getFlashcardStorage(@Value("${flashcards.storage.file:./flashcards.json}") String storageFile,
                                                Clock clock) {
        FileFlashcardStorage flashcardStorage = new FileFlashcardStorage(
                Path.of(storageFile), StoreObjectMapperFactory.createStoreObjectMapper(), clock);
        flashcardStorage.load();

        return flashcardStorage;
    }
}
