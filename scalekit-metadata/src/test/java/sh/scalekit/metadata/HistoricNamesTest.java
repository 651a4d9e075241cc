// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class HistoricNamesTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "T::Balance                             | Balance",
            "<T as Trait<I>>::Balance               | Balance",
            "Vec<<T as frame_system::Config>::Hash> | Vec<Hash>",
            "Compact<T::Moment>                     | Compact<Moment>",
            "&'static [u8]                          | Bytes",
            "&[u8]                                  | Bytes",
            "&'static str                           | Text",
            "BalanceOf<T>                           | BalanceOf",
            "BalanceOf<T, I>                        | BalanceOf",
            "(T::AccountId, u32)                    | (AccountId, u32)",
            "Option<T::BlockNumber>                 | Option<BlockNumber>",
            "RawOrigin<T::AccountId>                | RawOrigin<AccountId>"
    })
    void testSanitize(String historic, String expected) {
        assertEquals(expected, HistoricNames.sanitize(historic));
    }

    @ParameterizedTest
    @ValueSource(strings = {"u32", "Vec<u8>", "BTreeMap<Text, u64>", "TxHash"})
    void testPlainNamesAreUnchanged(String name) {
        assertEquals(name, HistoricNames.sanitize(name));
    }
}
