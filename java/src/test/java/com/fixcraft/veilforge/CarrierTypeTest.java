package com.fixcraft.veilforge;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CarrierTypeTest {

    @Test
    void tagsResolveCaseInsensitively() {
        assertEquals(CarrierType.IMAGE, CarrierType.fromTag("image"));
        assertEquals(CarrierType.VIDEO, CarrierType.fromTag(" Video "));
        assertEquals("document", CarrierType.DOCUMENT.tag());
    }

    @Test
    void unknownTagIsUnsupported() {
        StegoException exc = assertThrows(StegoException.class, () -> CarrierType.fromTag("hologram"));
        assertEquals(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, exc.kind());
        assertThrows(StegoException.class, () -> CarrierType.fromTag(null));
    }

    @Test
    void extensionWinsOverContent() {
        assertEquals(CarrierType.IMAGE, CarrierType.detect("photo.PNG", new byte[0]));
        assertEquals(CarrierType.AUDIO, CarrierType.detect("/tmp/song.mp3", new byte[0]));
        assertEquals(CarrierType.VIDEO, CarrierType.detect("clip.mkv", new byte[0]));
        assertEquals(CarrierType.DOCUMENT, CarrierType.detect("report.docx", CarrierFixtures.png(2, 2, 1)));
    }

    @Test
    void contentIsSniffedWithoutAnExtension() {
        assertEquals(CarrierType.IMAGE, CarrierType.detect("upload", CarrierFixtures.png(4, 4, 2)));
        assertEquals(CarrierType.IMAGE, CarrierType.detect("upload", CarrierFixtures.bmp(4, 4, 3)));
        assertEquals(CarrierType.AUDIO, CarrierType.detect("upload", CarrierFixtures.wav(8, 1, 16, 4)));
        assertEquals(CarrierType.DOCUMENT, CarrierType.detect("upload", CarrierFixtures.pdf()));
        assertEquals(CarrierType.DOCUMENT, CarrierType.detect(null, CarrierFixtures.zip(null)));
    }

    @Test
    void unrecognisedContentIsUnsupported() {
        StegoException exc = assertThrows(StegoException.class,
            () -> CarrierType.detect("blob", new byte[] {1, 2, 3, 4, 5}));
        assertEquals(StegoErrorKind.UNSUPPORTED_CARRIER_FORMAT, exc.kind());
    }

    @Test
    void videoHasTheHigherRedundancyFloor() {
        assertEquals(3, CarrierType.VIDEO.redundancyFloor());
        assertEquals(1, CarrierType.IMAGE.redundancyFloor());
        assertTrue(CarrierType.VIDEO.lossy());
        assertFalse(CarrierType.AUDIO.lossy());
    }
}
